/*
 * This file is part of ROBDD.
 * Copyright (c) 2026 Tobias Meggendorfer.
 *
 * ROBDD is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * ROBDD is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with ROBDD. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.robdd;

import org.immutables.value.Value;

@SuppressWarnings("MethodReturnAlwaysConstant")
@Value.Immutable
public class RobddConfiguration {
    public static final int DEFAULT_INITIAL_SIZE = 1024;
    public static final double DEFAULT_GROWTH_FACTOR = 1.5d;

    @Value.Default
    public int initialSize() {
        return DEFAULT_INITIAL_SIZE;
    }

    @Value.Default
    public double growthFactor() {
        return DEFAULT_GROWTH_FACTOR;
    }

    @Value.Default
    public boolean useExpansionCache() {
        return true;
    }

    @Value.Default
    public boolean threadSafetyCheck() {
        return false;
    }

    @Value.Default
    public boolean logStatisticsOnBuild() {
        return false;
    }

    @Value.Check
    protected void check() {
        Util.checkArgument(initialSize() > 0, "Initial size %d must be positive", initialSize());
        Util.checkArgument(growthFactor() > 1.0, "Growth factor %s must be larger than 1", growthFactor());
    }
}
