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

import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Immutable propositional formula over named variables. Equality and hashing are structural.
 *
 * <p>The factory methods build the tree exactly as given. Constants are only folded by
 * {@link #foldConstants()} and {@link #restrict(String, boolean)}.</p>
 */
public abstract class Expression {
    private static final Expression TRUE = new Constant(true);
    private static final Expression FALSE = new Constant(false);

    private final int hashCode;

    Expression(int hashCode) {
        this.hashCode = hashCode;
    }

    public static Expression constant(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static Expression variable(String name) {
        return new Variable(name);
    }

    public static Expression not(Expression child) {
        return new Not(child);
    }

    public static Expression and(Expression left, Expression right) {
        return new Binary(BinaryType.AND, left, right);
    }

    public static Expression or(Expression left, Expression right) {
        return new Binary(BinaryType.OR, left, right);
    }

    public static Expression xor(Expression left, Expression right) {
        return new Binary(BinaryType.XOR, left, right);
    }

    public static Expression implication(Expression left, Expression right) {
        return new Binary(BinaryType.IMPLICATION, left, right);
    }

    public static Expression equivalence(Expression left, Expression right) {
        return new Binary(BinaryType.EQUIVALENCE, left, right);
    }

    public static Expression binary(BinaryType type, Expression left, Expression right) {
        return new Binary(type, left, right);
    }

    private static Expression foldNot(Expression child) {
        return child.isConstant() ? constant(!child.constantValue()) : new Not(child);
    }

    private static Expression foldBinary(BinaryType type, Expression left, Expression right) {
        if (left.isConstant() && right.isConstant()) {
            return constant(type.apply(left.constantValue(), right.constantValue()));
        }
        if (left.isConstant()) {
            boolean value = left.constantValue();
            switch (type) {
                case AND:
                    return value ? right : FALSE;
                case OR:
                    return value ? TRUE : right;
                case XOR:
                    return value ? foldNot(right) : right;
                case IMPLICATION:
                    return value ? right : TRUE;
                case EQUIVALENCE:
                    return value ? right : foldNot(right);
                default:
                    throw new AssertionError("Unknown type " + type);
            }
        }
        if (right.isConstant()) {
            boolean value = right.constantValue();
            switch (type) {
                case AND:
                    return value ? left : FALSE;
                case OR:
                    return value ? TRUE : left;
                case XOR:
                    return value ? foldNot(left) : left;
                case IMPLICATION:
                    return value ? TRUE : foldNot(left);
                case EQUIVALENCE:
                    return value ? left : foldNot(left);
                default:
                    throw new AssertionError("Unknown type " + type);
            }
        }
        return new Binary(type, left, right);
    }

    public boolean isConstant() {
        return false;
    }

    /**
     * Returns the value of this constant.
     *
     * @throws IllegalStateException If this expression is not a constant.
     */
    public boolean constantValue() {
        throw new IllegalStateException(this + " is not a constant");
    }

    /**
     * Substitutes {@code value} for every occurrence of {@code variable} and folds the constants
     * this creates. Sub-trees not containing the variable are returned as the same instance. On an
     * expression without foldable constants, the result again has none, so it is either a
     * constant or free of constant leaves.
     */
    public abstract Expression restrict(String variable, boolean value);

    /**
     * Folds every constant sub-expression, e.g. {@code true & a} becomes {@code a}. No other
     * simplification is applied, {@code a & !a} stays as is.
     */
    public abstract Expression foldConstants();

    public abstract boolean evaluate(Predicate<String> assignment);

    /**
     * Evaluates this expression under the given assignment.
     *
     * @throws IllegalArgumentException If a variable of this expression is not assigned.
     */
    public boolean evaluate(Map<String, Boolean> assignment) {
        return evaluate(name -> {
            Boolean value = assignment.get(name);
            if (value == null) {
                throw new IllegalArgumentException("Variable " + name + " is not assigned");
            }
            return value;
        });
    }

    public Set<String> variables() {
        Set<String> set = new HashSet<>();
        gatherVariables(set);
        return set;
    }

    abstract void gatherVariables(Set<String> set);

    public abstract boolean hasVariable(String name);

    @Override
    public final int hashCode() {
        return hashCode;
    }

    public enum BinaryType {
        AND("&"), OR("|"), XOR("^"), IMPLICATION("->"), EQUIVALENCE("<->");

        private final String symbol;

        BinaryType(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean apply(boolean left, boolean right) {
            switch (this) {
                case AND:
                    return left && right;
                case OR:
                    return left || right;
                case XOR:
                    return left ^ right;
                case IMPLICATION:
                    return !left || right;
                case EQUIVALENCE:
                    return left == right;
                default:
                    throw new AssertionError("Unknown type " + this);
            }
        }
    }

    static final class Constant extends Expression {
        private final boolean value;

        Constant(boolean value) {
            super(Boolean.hashCode(value));
            this.value = value;
        }

        @Override
        public boolean isConstant() {
            return true;
        }

        @Override
        public boolean constantValue() {
            return value;
        }

        @Override
        public Expression restrict(String variable, boolean value) {
            return this;
        }

        @Override
        public Expression foldConstants() {
            return this;
        }

        @Override
        public boolean evaluate(Predicate<String> assignment) {
            return value;
        }

        @Override
        void gatherVariables(Set<String> set) {
            // No variables in this leaf
        }

        @Override
        public boolean hasVariable(String name) {
            return false;
        }

        @Override
        public boolean equals(Object object) {
            if (this == object) {
                return true;
            }
            if (!(object instanceof Constant)) {
                return false;
            }
            return value == ((Constant) object).value;
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    static final class Variable extends Expression {
        private final String name;

        Variable(String name) {
            super(Objects.requireNonNull(name).hashCode());
            this.name = name;
        }

        String name() {
            return name;
        }

        @Override
        public Expression restrict(String variable, boolean value) {
            return name.equals(variable) ? constant(value) : this;
        }

        @Override
        public Expression foldConstants() {
            return this;
        }

        @Override
        public boolean evaluate(Predicate<String> assignment) {
            return assignment.test(name);
        }

        @Override
        void gatherVariables(Set<String> set) {
            set.add(name);
        }

        @Override
        public boolean hasVariable(String name) {
            return this.name.equals(name);
        }

        @Override
        public boolean equals(Object object) {
            if (this == object) {
                return true;
            }
            if (!(object instanceof Variable)) {
                return false;
            }
            return name.equals(((Variable) object).name);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    static final class Not extends Expression {
        private final Expression child;

        Not(Expression child) {
            super(31 * Objects.requireNonNull(child).hashCode() + 1);
            this.child = child;
        }

        Expression child() {
            return child;
        }

        @Override
        public Expression restrict(String variable, boolean value) {
            Expression restricted = child.restrict(variable, value);
            return restricted == child ? this : foldNot(restricted);
        }

        @Override
        public Expression foldConstants() {
            Expression folded = child.foldConstants();
            return folded == child && !folded.isConstant() ? this : foldNot(folded);
        }

        @Override
        public boolean evaluate(Predicate<String> assignment) {
            return !child.evaluate(assignment);
        }

        @Override
        void gatherVariables(Set<String> set) {
            child.gatherVariables(set);
        }

        @Override
        public boolean hasVariable(String name) {
            return child.hasVariable(name);
        }

        @Override
        public boolean equals(Object object) {
            if (this == object) {
                return true;
            }
            if (!(object instanceof Not)) {
                return false;
            }
            Not that = (Not) object;
            return hashCode() == that.hashCode() && child.equals(that.child);
        }

        @Override
        public String toString() {
            return "!" + child;
        }
    }

    static final class Binary extends Expression {
        private final BinaryType type;
        private final Expression left;
        private final Expression right;

        Binary(BinaryType type, Expression left, Expression right) {
            super(Objects.hash(type.ordinal(), left, right));
            this.type = type;
            this.left = left;
            this.right = right;
        }

        BinaryType type() {
            return type;
        }

        Expression left() {
            return left;
        }

        Expression right() {
            return right;
        }

        @Override
        public Expression restrict(String variable, boolean value) {
            Expression restrictedLeft = left.restrict(variable, value);
            Expression restrictedRight = right.restrict(variable, value);
            if (restrictedLeft == left && restrictedRight == right) {
                return this;
            }
            return foldBinary(type, restrictedLeft, restrictedRight);
        }

        @Override
        public Expression foldConstants() {
            Expression foldedLeft = left.foldConstants();
            Expression foldedRight = right.foldConstants();
            if (foldedLeft == left && foldedRight == right && !left.isConstant() && !right.isConstant()) {
                return this;
            }
            return foldBinary(type, foldedLeft, foldedRight);
        }

        @Override
        public boolean evaluate(Predicate<String> assignment) {
            return type.apply(left.evaluate(assignment), right.evaluate(assignment));
        }

        @Override
        void gatherVariables(Set<String> set) {
            left.gatherVariables(set);
            right.gatherVariables(set);
        }

        @Override
        public boolean hasVariable(String name) {
            return left.hasVariable(name) || right.hasVariable(name);
        }

        @Override
        public boolean equals(Object object) {
            if (this == object) {
                return true;
            }
            if (!(object instanceof Binary)) {
                return false;
            }
            Binary that = (Binary) object;
            return type == that.type && hashCode() == that.hashCode()
                    && left.equals(that.left) && right.equals(that.right);
        }

        @Override
        public String toString() {
            return "(" + left + " " + type.symbol() + " " + right + ")";
        }
    }
}
