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

import de.tum.in.robdd.Expression.BinaryType;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Parses propositional formulas such as {@code (a & !c) | (b ^ d)}.
 *
 * <p>Operators, from weakest to strongest binding: {@code <->}, {@code ->}, {@code |},
 * {@code ^}, {@code &}, followed by the prefix negation {@code !}. Implication and equivalence
 * associate to the right, all other binary operators to the left. Identifiers start with a letter
 * or underscore and continue with letters, digits or underscores; {@code true} and
 * {@code false} are constants.</p>
 */
public final class FormulaParser {
    private static final Map<String, BinaryType> BINARY_OPERATORS = Map.of(
            "<->", BinaryType.EQUIVALENCE,
            "->", BinaryType.IMPLICATION,
            "|", BinaryType.OR,
            "^", BinaryType.XOR,
            "&", BinaryType.AND);
    private static final int NEGATION_PRECEDENCE = precedence(BinaryType.AND) + 1;

    private final String formula;
    private final List<Token> tokens;
    private int index = 0;

    private FormulaParser(String formula, List<Token> tokens) {
        this.formula = formula;
        this.tokens = tokens;
    }

    public static Expression parse(String formula) throws InvalidFormatException {
        FormulaParser parser = new FormulaParser(formula, tokenize(formula));
        Expression expression = parser.parseExpression(0);
        if (parser.index != parser.tokens.size()) {
            Token trailing = parser.tokens.get(parser.index);
            throw new InvalidFormatException(String.format("Trailing input '%s' at position %d in %s",
                    formula.substring(trailing.position), trailing.position, formula));
        }
        return expression;
    }

    private static int precedence(BinaryType type) {
        switch (type) {
            case EQUIVALENCE:
                return 1;
            case IMPLICATION:
                return 2;
            case OR:
                return 3;
            case XOR:
                return 4;
            case AND:
                return 5;
            default:
                throw new AssertionError("Unknown type " + type);
        }
    }

    private static boolean isRightAssociative(BinaryType type) {
        return type == BinaryType.IMPLICATION || type == BinaryType.EQUIVALENCE;
    }

    static List<Token> tokenize(String formula) throws InvalidFormatException {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        int length = formula.length();
        while (i < length) {
            char character = formula.charAt(i);
            if (Character.isWhitespace(character)) {
                i += 1;
            } else if (Character.isLetter(character) || character == '_') {
                int end = i + 1;
                while (end < length && (Character.isLetterOrDigit(formula.charAt(end)) || formula.charAt(end) == '_')) {
                    end += 1;
                }
                tokens.add(new Token(formula.substring(i, end), i));
                i = end;
            } else if ("()!&|^".indexOf(character) >= 0) {
                tokens.add(new Token(String.valueOf(character), i));
                i += 1;
            } else if (formula.startsWith("<->", i)) {
                tokens.add(new Token("<->", i));
                i += 3;
            } else if (formula.startsWith("->", i)) {
                tokens.add(new Token("->", i));
                i += 2;
            } else {
                throw new InvalidFormatException(String.format("Unexpected character '%c' at position %d in %s",
                        character, i, formula));
            }
        }
        return tokens;
    }

    @Nullable
    private Token peek() {
        return index < tokens.size() ? tokens.get(index) : null;
    }

    private Expression parseExpression(int minimumPrecedence) throws InvalidFormatException {
        Expression left = parsePrefix();

        while (true) {
            Token token = peek();
            if (token == null) {
                break;
            }
            BinaryType type = BINARY_OPERATORS.get(token.text);
            if (type == null) {
                break;
            }
            int precedence = precedence(type);
            if (precedence < minimumPrecedence) {
                break;
            }
            index += 1;
            Expression right = parseExpression(isRightAssociative(type) ? precedence : precedence + 1);
            left = Expression.binary(type, left, right);
        }
        return left;
    }

    private Expression parsePrefix() throws InvalidFormatException {
        Token token = peek();
        if (token == null) {
            throw new InvalidFormatException("Unexpected end of input in " + formula);
        }
        index += 1;
        switch (token.text) {
            case "!":
                return Expression.not(parseExpression(NEGATION_PRECEDENCE));
            case "(": {
                Expression inner = parseExpression(0);
                Token closing = peek();
                if (closing == null || !")".equals(closing.text)) {
                    throw new InvalidFormatException(String.format("Missing ')' for '(' at position %d in %s",
                            token.position, formula));
                }
                index += 1;
                return inner;
            }
            case "true":
                return Expression.constant(true);
            case "false":
                return Expression.constant(false);
            default:
                if (!token.isIdentifier()) {
                    throw new InvalidFormatException(String.format("Unexpected '%s' at position %d in %s",
                            token.text, token.position, formula));
                }
                return Expression.variable(token.text);
        }
    }

    static final class Token {
        final String text;
        final int position;

        Token(String text, int position) {
            this.text = text;
            this.position = position;
        }

        boolean isIdentifier() {
            char first = text.charAt(0);
            return Character.isLetter(first) || first == '_';
        }

        @Override
        public String toString() {
            return text + "@" + position;
        }
    }

    public static class InvalidFormatException extends Exception {
        private static final long serialVersionUID = 1L;

        public InvalidFormatException(String message) {
            super(message);
        }
    }
}
