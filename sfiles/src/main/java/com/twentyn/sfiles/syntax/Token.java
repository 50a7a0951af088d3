/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.twentyn.sfiles.syntax;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One element of SFILES text.  Tokens are immutable; the text payload holds the content of a unit or of a tag block,
 * the index holds the number of a recycle or signal marker.
 */
public class Token {
  public static final String SEPARATOR_TEXT = "n|";
  public static final String TAG_ENTRY_SEPARATOR = ";";

  private final TokenKind kind;
  private final String text;
  private final int index;
  private final int offset;

  private Token(TokenKind kind, String text, int index, int offset) {
    this.kind = kind;
    this.text = text;
    this.index = index;
    this.offset = offset;
  }

  public static Token unit(String content, int offset) {
    return new Token(TokenKind.NODE, content, -1, offset);
  }

  public static Token marker(TokenKind kind, int index, int offset) {
    if (!kind.isMarker()) {
      throw new IllegalArgumentException(String.format("%s is not a marker token", kind));
    }
    return new Token(kind, null, index, offset);
  }

  public static Token tagBlock(String content, int offset) {
    return new Token(TokenKind.TAG_BLOCK, content, -1, offset);
  }

  public static Token symbol(TokenKind kind, int offset) {
    if (kind == TokenKind.NODE || kind == TokenKind.TAG_BLOCK || kind.isMarker()) {
      throw new IllegalArgumentException(String.format("%s tokens carry a payload", kind));
    }
    return new Token(kind, null, -1, offset);
  }

  public TokenKind getKind() {
    return kind;
  }

  public String getText() {
    return text;
  }

  public int getIndex() {
    return index;
  }

  /**
   * @return The position of the token in the text it was read from, or -1 for generated tokens.
   */
  public int getOffset() {
    return offset;
  }

  /**
   * @return The entries of a tag block in order; empty for an empty block.
   */
  public List<String> getTagEntries() {
    if (kind != TokenKind.TAG_BLOCK) {
      throw new IllegalStateException("Only tag blocks carry tag entries");
    }
    if (text.isEmpty()) {
      return Collections.emptyList();
    }
    return Arrays.asList(text.split(TAG_ENTRY_SEPARATOR, -1));
  }

  public static String formatIndex(int index) {
    return index < 10 ? Integer.toString(index) : "%" + index;
  }

  public String toText() {
    switch (kind) {
      case NODE:
        return "(" + text + ")";
      case BRANCH_OPEN:
        return "[";
      case BRANCH_CLOSE:
        return "]";
      case INCOMING_BRANCH_OPEN:
        return "<&|";
      case INCOMING_BRANCH_CLOSE:
        return "&|";
      case CYCLE_OPEN:
        return "<" + formatIndex(index);
      case CYCLE_CLOSE:
        return formatIndex(index);
      case SIGNAL_OPEN:
        return "<_" + formatIndex(index);
      case SIGNAL_CLOSE:
        return "_" + formatIndex(index);
      case TAG_BLOCK:
        return "{" + text + "}";
      case COMPONENT_SEPARATOR:
        return SEPARATOR_TEXT;
      default:
        throw new IllegalStateException("Unhandled token kind " + kind);
    }
  }

  public static String render(List<Token> tokens) {
    StringBuilder sb = new StringBuilder();
    tokens.forEach(t -> sb.append(t.toText()));
    return sb.toString();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Token token = (Token) o;
    return index == token.index && kind == token.kind && Objects.equals(text, token.text);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, text, index);
  }

  @Override
  public String toString() {
    return kind + ":" + toText();
  }
}
