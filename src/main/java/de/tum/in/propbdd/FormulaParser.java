/*
 * This file is part of PropBDD.
 * Copyright (c) 2024 The PropBDD contributors.
 *
 * PropBDD is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * PropBDD is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with PropBDD. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.propbdd;

import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Recursive-descent parser for propositional formulas.
 *
 * <p>Connectives, from lowest to highest precedence:</p>
 * <ul>
 *   <li>{@code ↔ <-> <=>} biconditional, left-associative</li>
 *   <li>{@code → -> =>} implication, right-associative</li>
 *   <li>{@code ∨ | \/} disjunction, left-associative</li>
 *   <li>{@code ∧ & /\} conjunction, left-associative</li>
 *   <li>{@code ¬ ~ !} negation, prefix</li>
 * </ul>
 *
 * <p>Variables match {@code [A-Za-z][A-Za-z0-9_]*}, parentheses group and whitespace is ignored.</p>
 */
public final class FormulaParser {
    // Multi-character spellings come first, otherwise "<->" would be read as "<", "-", ">"
    private static final String[][] SPELLINGS = {
        {"<->", "↔"}, {"<=>", "↔"},
        {"->", "→"}, {"=>", "→"},
        {"/\\", "∧"}, {"\\/", "∨"},
        {"↔", "↔"}, {"→", "→"},
        {"¬", "¬"}, {"~", "¬"}, {"!", "¬"},
        {"∧", "∧"}, {"&", "∧"},
        {"∨", "∨"}, {"|", "∨"},
        {"(", "("}, {")", ")"}
    };

    private final List<Token> tokens;
    private int position = 0;

    private FormulaParser(String text) {
        this.tokens = tokenize(text);
    }

    /**
     * Parses the given text.
     *
     * @throws FormulaSyntaxException if the text is not a well-formed formula.
     */
    public static Formula parse(String text) {
        return new FormulaParser(text).parseFormula();
    }

    private static List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        int index = 0;
        int length = text.length();
        while (index < length) {
            char character = text.charAt(index);
            if (Character.isWhitespace(character)) {
                index += 1;
                continue;
            }
            if (isLetter(character)) {
                int start = index;
                index += 1;
                while (index < length && isIdentifierPart(text.charAt(index))) {
                    index += 1;
                }
                tokens.add(new Token(TokenType.VARIABLE, text.substring(start, index), start));
                continue;
            }
            String[] match = null;
            for (String[] spelling : SPELLINGS) {
                if (text.startsWith(spelling[0], index)) {
                    match = spelling;
                    break;
                }
            }
            if (match == null) {
                throw new FormulaSyntaxException("Unexpected character '" + character + "'", index);
            }
            tokens.add(new Token(TokenType.SYMBOL, match[1], index));
            index += match[0].length();
        }
        return tokens;
    }

    private static boolean isLetter(char character) {
        return ('a' <= character && character <= 'z') || ('A' <= character && character <= 'Z');
    }

    private static boolean isIdentifierPart(char character) {
        return isLetter(character) || ('0' <= character && character <= '9') || character == '_';
    }

    @Nullable
    private Token current() {
        return position < tokens.size() ? tokens.get(position) : null;
    }

    private boolean atSymbol(String symbol) {
        Token token = current();
        return token != null && token.type == TokenType.SYMBOL && token.text.equals(symbol);
    }

    private void expect(String symbol) {
        Token token = current();
        if (token == null) {
            throw new FormulaSyntaxException("Expected '" + symbol + "'", -1);
        }
        if (token.type != TokenType.SYMBOL || !token.text.equals(symbol)) {
            throw new FormulaSyntaxException(
                    "Expected '" + symbol + "' but got '" + token.text + "'", token.position);
        }
        position += 1;
    }

    private Formula parseFormula() {
        Formula result = parseIff();
        Token trailing = current();
        if (trailing != null) {
            throw new FormulaSyntaxException("Unexpected token '" + trailing.text + "'", trailing.position);
        }
        return result;
    }

    private Formula parseIff() {
        Formula left = parseImplies();
        while (atSymbol("↔")) {
            position += 1;
            Formula right = parseImplies();
            left = Formula.iff(left, right);
        }
        return left;
    }

    private Formula parseImplies() {
        Formula left = parseOr();
        if (atSymbol("→")) {
            position += 1;
            Formula right = parseImplies();
            return Formula.implies(left, right);
        }
        return left;
    }

    private Formula parseOr() {
        Formula left = parseAnd();
        while (atSymbol("∨")) {
            position += 1;
            Formula right = parseAnd();
            left = Formula.or(left, right);
        }
        return left;
    }

    private Formula parseAnd() {
        Formula left = parseNot();
        while (atSymbol("∧")) {
            position += 1;
            Formula right = parseNot();
            left = Formula.and(left, right);
        }
        return left;
    }

    private Formula parseNot() {
        if (atSymbol("¬")) {
            position += 1;
            return Formula.not(parseNot());
        }
        return parsePrimary();
    }

    private Formula parsePrimary() {
        Token token = current();
        if (token == null) {
            throw new FormulaSyntaxException("Missing operand", -1);
        }
        if (token.type == TokenType.VARIABLE) {
            position += 1;
            return Formula.variable(token.text);
        }
        if (token.text.equals("(")) {
            position += 1;
            Formula formula = parseIff();
            if (current() == null) {
                throw new FormulaSyntaxException("Unmatched '(' opened at position " + token.position, -1);
            }
            expect(")");
            return formula;
        }
        throw new FormulaSyntaxException("Missing operand before '" + token.text + "'", token.position);
    }

    private enum TokenType {
        VARIABLE,
        SYMBOL
    }

    private static final class Token {
        final TokenType type;
        final String text;
        final int position;

        Token(TokenType type, String text, int position) {
            this.type = type;
            this.text = text;
            this.position = position;
        }
    }
}
