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

/**
 * The two generations of the notation.  V1 is the legacy form with branches and recycles only; V2 adds tag blocks
 * for heat integration, column and signal annotations.
 */
public enum SfilesVersion {
  V1,
  V2;

  public boolean supportsTags() {
    return this == V2;
  }

  public static SfilesVersion fromText(String text) {
    for (SfilesVersion v : values()) {
      if (v.name().equalsIgnoreCase(text)) {
        return v;
      }
    }
    throw new IllegalArgumentException(String.format("Unknown SFILES version '%s', expected v1 or v2", text));
  }
}
