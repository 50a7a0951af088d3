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

package com.twentyn.sfiles.vocabulary;

import java.util.Set;

/**
 * A one-to-one mapping between human readable unit operation names and the short codes written inside SFILES unit
 * tokens.  The codec itself only ever sees codes.
 */
public interface UnitVocabulary {

  /**
   * @throws IllegalArgumentException if the name is not part of this vocabulary.
   */
  String toCode(String name);

  /**
   * @throws IllegalArgumentException if the code is not part of this vocabulary.
   */
  String toName(String code);

  boolean hasCode(String code);

  Set<String> getCodes();
}
