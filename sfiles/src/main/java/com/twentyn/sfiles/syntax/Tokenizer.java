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

import com.twentyn.sfiles.MalformedSyntaxException;
import com.twentyn.sfiles.graph.EdgeTags;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Splits SFILES text into tokens.  This is a pure function of its input: bracket balance, marker digits, unit labels
 * and tag entry syntax are all checked here, while everything that needs to know about the graph is left to the
 * builder.
 *
 * Whitespace is not part of the notation and is rejected wherever it occurs.
 */
public class Tokenizer {

  private final String text;
  private final List<Token> tokens = new ArrayList<>();
  // Offsets of currently open '[' and '<&|', with the matching token kind.
  private final Deque<Token> openers = new ArrayDeque<>();
  private int pos = 0;

  // A marker must directly describe a unit, so it may only follow a unit, a marker, or tags on those.
  private boolean markerAllowed = false;
  private boolean tagAllowed = false;

  private Tokenizer(String text) {
    this.text = text;
  }

  /**
   * Tokenizes SFILES text.
   *
   * @param text The SFILES string.
   * @return The tokens in text order.
   * @throws MalformedSyntaxException at the first offending character.
   */
  public static List<Token> tokenize(String text) throws MalformedSyntaxException {
    if (text == null) {
      throw new IllegalArgumentException("Cannot tokenize null text");
    }
    Tokenizer tokenizer = new Tokenizer(text);
    tokenizer.run();
    return tokenizer.tokens;
  }

  private void run() throws MalformedSyntaxException {
    while (pos < text.length()) {
      char c = text.charAt(pos);
      if (Character.isWhitespace(c)) {
        throw new MalformedSyntaxException("Whitespace is not allowed in SFILES", pos);
      }
      switch (c) {
        case '(':
          readUnit();
          break;
        case '[':
          expectOrigin("branch");
          Token open = Token.symbol(TokenKind.BRANCH_OPEN, pos);
          openers.push(open);
          emit(open, false, false);
          pos++;
          break;
        case ']':
          closeOpener(TokenKind.BRANCH_OPEN, "]");
          emit(Token.symbol(TokenKind.BRANCH_CLOSE, pos), false, false);
          pos++;
          break;
        case '<':
          readReceivingEnd();
          break;
        case '&':
          expect("&|");
          closeOpener(TokenKind.INCOMING_BRANCH_OPEN, "&|");
          emit(Token.symbol(TokenKind.INCOMING_BRANCH_CLOSE, pos), false, true);
          pos += 2;
          break;
        case '_':
          readMarker(TokenKind.SIGNAL_CLOSE, pos, pos + 1);
          break;
        case '%':
          readMarker(TokenKind.CYCLE_CLOSE, pos, pos);
          break;
        case '{':
          readTagBlock();
          break;
        case 'n':
          readSeparator();
          break;
        default:
          if (Character.isDigit(c)) {
            readMarker(TokenKind.CYCLE_CLOSE, pos, pos);
          } else {
            throw new MalformedSyntaxException(String.format("Unexpected character '%c'", c), pos);
          }
      }
    }

    if (!openers.isEmpty()) {
      Token unclosed = openers.peek();
      throw new MalformedSyntaxException(
          String.format("'%s' is never closed", unclosed.toText()), unclosed.getOffset());
    }
    if (!tokens.isEmpty() && last().getKind() == TokenKind.COMPONENT_SEPARATOR) {
      throw new MalformedSyntaxException("SFILES cannot end with a separator", last().getOffset());
    }
  }

  private Token last() {
    return tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
  }

  private void emit(Token token, boolean allowMarker, boolean allowTag) {
    tokens.add(token);
    markerAllowed = allowMarker;
    tagAllowed = allowTag;
  }

  private void expect(String literal) throws MalformedSyntaxException {
    if (!text.startsWith(literal, pos)) {
      throw new MalformedSyntaxException(String.format("Expected '%s'", literal), pos);
    }
  }

  private void expectOrigin(String what) throws MalformedSyntaxException {
    Token prev = last();
    if (prev == null || prev.getKind() == TokenKind.COMPONENT_SEPARATOR) {
      throw new MalformedSyntaxException(String.format("A %s needs a preceding unit", what), pos);
    }
  }

  private void closeOpener(TokenKind openerKind, String closer) throws MalformedSyntaxException {
    if (openers.isEmpty() || openers.peek().getKind() != openerKind) {
      throw new MalformedSyntaxException(String.format("Unmatched '%s'", closer), pos);
    }
    openers.pop();
  }

  private void readUnit() throws MalformedSyntaxException {
    int end = text.indexOf(')', pos);
    if (end < 0) {
      throw new MalformedSyntaxException("Unit is never closed", pos);
    }
    String content = text.substring(pos + 1, end);
    if (UnitLabel.parse(content) == null) {
      throw new MalformedSyntaxException(String.format("Invalid unit '%s'", content), pos);
    }
    emit(Token.unit(content, pos), true, true);
    pos = end + 1;
  }

  private void readReceivingEnd() throws MalformedSyntaxException {
    int start = pos;
    if (text.startsWith("<&|", pos)) {
      Token open = Token.symbol(TokenKind.INCOMING_BRANCH_OPEN, pos);
      openers.push(open);
      emit(open, false, false);
      pos += 3;
    } else if (text.startsWith("<_", pos)) {
      readMarker(TokenKind.SIGNAL_OPEN, start, pos + 2);
    } else {
      readMarker(TokenKind.CYCLE_OPEN, start, pos + 1);
    }
  }

  /**
   * Reads a marker number at numberStart: a single digit, or '%' followed by exactly two digits.
   */
  private void readMarker(TokenKind kind, int start, int numberStart) throws MalformedSyntaxException {
    if (!markerAllowed) {
      throw new MalformedSyntaxException("Recycle and signal markers must follow a unit", start);
    }
    int index;
    int next;
    if (numberStart < text.length() && Character.isDigit(text.charAt(numberStart))) {
      index = text.charAt(numberStart) - '0';
      next = numberStart + 1;
    } else if (numberStart + 2 < text.length() && text.charAt(numberStart) == '%' &&
        Character.isDigit(text.charAt(numberStart + 1)) && Character.isDigit(text.charAt(numberStart + 2))) {
      index = Integer.parseInt(text.substring(numberStart + 1, numberStart + 3));
      next = numberStart + 3;
    } else {
      throw new MalformedSyntaxException("Expected a marker number (a digit or %##)", numberStart);
    }
    emit(Token.marker(kind, index, start), true, true);
    pos = next;
  }

  private void readTagBlock() throws MalformedSyntaxException {
    if (!tagAllowed) {
      throw new MalformedSyntaxException("A tag block must follow a unit, a join or a marker", pos);
    }
    int end = text.indexOf('}', pos);
    if (end < 0) {
      throw new MalformedSyntaxException("Tag block is never closed", pos);
    }
    String content = text.substring(pos + 1, end);
    if (!content.isEmpty()) {
      int entryOffset = pos + 1;
      for (String entry : content.split(Token.TAG_ENTRY_SEPARATOR, -1)) {
        if (!EdgeTags.isWellFormedEntry(entry)) {
          throw new MalformedSyntaxException(
              String.format("Tag entry '%s' is not of the form <kind>_<qualifier>", entry), entryOffset);
        }
        entryOffset += entry.length() + 1;
      }
    }
    // Tags do not change what may come next.
    boolean allowMarker = markerAllowed;
    emit(Token.tagBlock(content, pos), allowMarker, true);
    pos = end + 1;
  }

  private void readSeparator() throws MalformedSyntaxException {
    expect(Token.SEPARATOR_TEXT);
    if (!openers.isEmpty()) {
      throw new MalformedSyntaxException("A separator cannot appear inside a branch", pos);
    }
    Token prev = last();
    if (prev == null || prev.getKind() == TokenKind.COMPONENT_SEPARATOR) {
      throw new MalformedSyntaxException("A separator must follow a unit", pos);
    }
    emit(Token.symbol(TokenKind.COMPONENT_SEPARATOR, pos), false, false);
    pos += 2;
  }
}
