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

import java.math.BigInteger;
import java.util.BitSet;
import java.util.List;
import java.util.Optional;

/**
 * Forwards every call to a delegate, giving subclasses a hook before and after each call.
 */
public abstract class DelegatingRobdd implements Robdd {
    private final Robdd delegate;

    public DelegatingRobdd(Robdd delegate) {
        this.delegate = delegate;
    }

    protected void onEnter(String name) {
        // Empty
    }

    protected void onExit() {
        // Empty
    }

    @Override
    public int build(Expression expression, VariableOrdering ordering) {
        onEnter("build");
        try {
            return delegate.build(expression, ordering);
        } finally {
            onExit();
        }
    }

    @Override
    public int build(Expression expression, List<String> ordering) {
        onEnter("build");
        try {
            return delegate.build(expression, ordering);
        } finally {
            onExit();
        }
    }

    @Override
    public int falseNode() {
        onEnter("falseNode");
        try {
            return delegate.falseNode();
        } finally {
            onExit();
        }
    }

    @Override
    public int trueNode() {
        onEnter("trueNode");
        try {
            return delegate.trueNode();
        } finally {
            onExit();
        }
    }

    @Override
    public boolean isLeaf(int node) {
        onEnter("isLeaf");
        try {
            return delegate.isLeaf(node);
        } finally {
            onExit();
        }
    }

    @Override
    public Optional<Boolean> terminalValue(int node) {
        onEnter("terminalValue");
        try {
            return delegate.terminalValue(node);
        } finally {
            onExit();
        }
    }

    @Override
    public int variableOf(int node) {
        onEnter("variableOf");
        try {
            return delegate.variableOf(node);
        } finally {
            onExit();
        }
    }

    @Override
    public int low(int node) {
        onEnter("low");
        try {
            return delegate.low(node);
        } finally {
            onExit();
        }
    }

    @Override
    public int high(int node) {
        onEnter("high");
        try {
            return delegate.high(node);
        } finally {
            onExit();
        }
    }

    @Override
    public String variableName(int variable) {
        onEnter("variableName");
        try {
            return delegate.variableName(variable);
        } finally {
            onExit();
        }
    }

    @Override
    public int numberOfVariables() {
        onEnter("numberOfVariables");
        try {
            return delegate.numberOfVariables();
        } finally {
            onExit();
        }
    }

    @Override
    public int nodeCount() {
        onEnter("nodeCount");
        try {
            return delegate.nodeCount();
        } finally {
            onExit();
        }
    }

    @Override
    public void forEachNodeBelowOnce(int node, NodeVisitor visitor) {
        onEnter("forEachNodeBelowOnce");
        try {
            delegate.forEachNodeBelowOnce(node, visitor);
        } finally {
            onExit();
        }
    }

    @Override
    public int reachableNodeCount(int node) {
        onEnter("reachableNodeCount");
        try {
            return delegate.reachableNodeCount(node);
        } finally {
            onExit();
        }
    }

    @Override
    public BitSet support(int node) {
        onEnter("support");
        try {
            return delegate.support(node);
        } finally {
            onExit();
        }
    }

    @Override
    public boolean evaluate(int node, boolean[] assignment) {
        onEnter("evaluate");
        try {
            return delegate.evaluate(node, assignment);
        } finally {
            onExit();
        }
    }

    @Override
    public BigInteger satisfyingAssignmentCount(int node, int variableCount) {
        onEnter("satisfyingAssignmentCount");
        try {
            return delegate.satisfyingAssignmentCount(node, variableCount);
        } finally {
            onExit();
        }
    }

    @Override
    public boolean check() {
        onEnter("check");
        try {
            return delegate.check();
        } finally {
            onExit();
        }
    }

    @Override
    public String statistics() {
        onEnter("statistics");
        try {
            return delegate.statistics();
        } finally {
            onExit();
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + delegate + "]";
    }
}
