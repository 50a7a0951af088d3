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

import java.util.Objects;

public class SignalTag {
  public static final String PREFIX = "sig_";

  private final String qualifier;

  public SignalTag(String qualifier) {
    if (qualifier == null || qualifier.isEmpty()) {
      throw new IllegalArgumentException("Signal tags need a qualifier");
    }
    this.qualifier = qualifier;
  }

  public String getQualifier() {
    return qualifier;
  }

  public String toText() {
    return PREFIX + qualifier;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    return qualifier.equals(((SignalTag) o).qualifier);
  }

  @Override
  public int hashCode() {
    return Objects.hash(qualifier);
  }

  @Override
  public String toString() {
    return toText();
  }
}
