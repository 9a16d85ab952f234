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

/**
 * Thrown when formula text can not be parsed.
 */
public class FormulaSyntaxException extends IllegalArgumentException {
    private static final long serialVersionUID = 4839570981257036241L;

    private final int position;

    public FormulaSyntaxException(String message, int position) {
        super(position < 0 ? message + " at end of input" : message + " at position " + position);
        this.position = position;
    }

    /**
     * Returns the offset of the offending character in the input, or {@code -1} if the input ended
     * prematurely.
     */
    public int position() {
        return position;
    }
}
