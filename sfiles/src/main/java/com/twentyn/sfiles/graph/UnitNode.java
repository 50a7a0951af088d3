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

package com.twentyn.sfiles.graph;

import java.util.Comparator;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A unit operation in a flowsheet.  The id is the node's slot in its owning {@link Flowsheet}; the type, index and
 * optional sub-index form the unit's name, e.g. "hex-2/1" for the first stream pair of the second exchanger.
 */
public class UnitNode {
  public static final Pattern TYPE_PATTERN = Pattern.compile("^[A-Za-z][A-Za-z0-9]*$");

  /**
   * The explicit ordering of last resort: index, then sub-index (whole units first), then type.
   */
  public static final Comparator<UnitNode> NUMERIC_ORDER = Comparator
      .comparingInt(UnitNode::getIndex)
      .thenComparing(UnitNode::getSubIndex, Comparator.nullsFirst(Comparator.naturalOrder()))
      .thenComparing(UnitNode::getType);

  private final int id;
  private final String type;
  private final int index;
  private final Integer subIndex;

  UnitNode(int id, String type, int index, Integer subIndex) {
    if (type == null || !TYPE_PATTERN.matcher(type).matches()) {
      throw new IllegalArgumentException(String.format("Invalid unit type '%s'", type));
    }
    if (index <= 0) {
      throw new IllegalArgumentException(String.format("Unit index must be positive, got %d", index));
    }
    if (subIndex != null && subIndex <= 0) {
      throw new IllegalArgumentException(String.format("Unit sub-index must be positive, got %d", subIndex));
    }
    this.id = id;
    this.type = type;
    this.index = index;
    this.subIndex = subIndex;
  }

  public int getId() {
    return id;
  }

  public String getType() {
    return type;
  }

  public int getIndex() {
    return index;
  }

  public Integer getSubIndex() {
    return subIndex;
  }

  public boolean isSubNode() {
    return subIndex != null;
  }

  /**
   * The name shared by all sub-nodes of one exchanger, "type-index".
   */
  public String getFamilyName() {
    return type + "-" + index;
  }

  public String getName() {
    return subIndex == null ? getFamilyName() : getFamilyName() + "/" + subIndex;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    UnitNode unitNode = (UnitNode) o;
    return id == unitNode.id && index == unitNode.index && type.equals(unitNode.type) &&
        Objects.equals(subIndex, unitNode.subIndex);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, type, index, subIndex);
  }

  @Override
  public String toString() {
    return getName();
  }
}
