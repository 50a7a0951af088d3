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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The content of a unit token: a type, optionally followed by a numeric label and a sub-node label, as in "hex",
 * "hex-3" or "hex-3/2".  Labels only group tokens that name the same unit; actual numbering happens when a graph is
 * built.
 */
public class UnitLabel {
  private static final Pattern LABEL_PATTERN =
      Pattern.compile("^([A-Za-z][A-Za-z0-9]*)(?:-([0-9]{1,9})(?:/([0-9]{1,9}))?)?$");

  private final String type;
  private final Integer index;
  private final Integer subIndex;

  public UnitLabel(String type, Integer index, Integer subIndex) {
    this.type = type;
    this.index = index;
    this.subIndex = subIndex;
  }

  /**
   * @return The parsed label, or null if the content is not a valid unit label.
   */
  public static UnitLabel parse(String content) {
    Matcher m = LABEL_PATTERN.matcher(content);
    if (!m.matches()) {
      return null;
    }
    Integer index = m.group(2) == null ? null : Integer.valueOf(m.group(2));
    Integer subIndex = m.group(3) == null ? null : Integer.valueOf(m.group(3));
    return new UnitLabel(m.group(1), index, subIndex);
  }

  public String getType() {
    return type;
  }

  public Integer getIndex() {
    return index;
  }

  public Integer getSubIndex() {
    return subIndex;
  }

  public boolean isNumbered() {
    return index != null;
  }

  public String toText() {
    if (index == null) {
      return type;
    }
    return subIndex == null ? type + "-" + index : type + "-" + index + "/" + subIndex;
  }
}
