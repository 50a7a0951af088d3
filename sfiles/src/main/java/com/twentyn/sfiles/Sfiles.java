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

package com.twentyn.sfiles;

import com.twentyn.sfiles.canonical.CanonicalEncoder;
import com.twentyn.sfiles.graph.Flowsheet;
import com.twentyn.sfiles.parser.GraphBuilder;
import com.twentyn.sfiles.syntax.Token;
import com.twentyn.sfiles.syntax.TokenKind;
import com.twentyn.sfiles.syntax.Tokenizer;

import java.util.List;

/**
 * Entry points for reading and writing SFILES.  All methods are stateless and may be called from any thread.
 */
public class Sfiles {

  private Sfiles() {
  }

  /**
   * Parses SFILES text of either version.
   *
   * @param text The SFILES string.
   * @return A new flowsheet, with units numbered per type in order of appearance.
   * @throws SfilesException if the text is not valid SFILES.
   */
  public static Flowsheet parse(String text) throws SfilesException {
    return GraphBuilder.build(Tokenizer.tokenize(text));
  }

  /**
   * Parses SFILES text written in a given version.  V1 text may not contain tag blocks.
   */
  public static Flowsheet parse(String text, SfilesVersion version) throws SfilesException {
    List<Token> tokens = Tokenizer.tokenize(text);
    if (!version.supportsTags()) {
      for (Token t : tokens) {
        if (t.getKind() == TokenKind.TAG_BLOCK) {
          throw new MalformedSyntaxException(
              String.format("Tag blocks are not part of SFILES %s", version), t.getOffset());
        }
      }
    }
    return GraphBuilder.build(tokens);
  }

  public static String encode(Flowsheet flowsheet, SfilesVersion version, boolean canonical, boolean removeNumbering)
      throws SfilesException {
    return encode(flowsheet, EncoderOptions.builder()
        .setVersion(version)
        .setCanonical(canonical)
        .setRemoveNumbering(removeNumbering)
        .build());
  }

  public static String encode(Flowsheet flowsheet, EncoderOptions options) throws SfilesException {
    return new CanonicalEncoder(options).encode(flowsheet);
  }

  /**
   * Rewrites SFILES text in its canonical V2 form.  Two strings describe the same flowsheet exactly when their
   * canonical forms are equal.
   */
  public static String canonicalize(String text) throws SfilesException {
    return encode(parse(text), EncoderOptions.DEFAULT);
  }
}
