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

/**
 * Records where a stream is attached to a column: top, bottom or a side draw, entering or leaving.
 */
public class ColumnTag {

  public enum Position {
    TOP("top"),
    BOTTOM("bottom"),
    SIDE("side");

    private final String text;

    Position(String text) {
      this.text = text;
    }

    public String getText() {
      return text;
    }

    public static Position fromText(String text) {
      for (Position p : values()) {
        if (p.text.equals(text)) {
          return p;
        }
      }
      throw new IllegalArgumentException(String.format("Unknown column position '%s'", text));
    }
  }

  private final Position position;
  private final Port port;

  public ColumnTag(Position position, Port port) {
    if (position == null || port == null) {
      throw new IllegalArgumentException("Column tags need both a position and a port");
    }
    this.position = position;
    this.port = port;
  }

  public Position getPosition() {
    return position;
  }

  public Port getPort() {
    return port;
  }

  public String toText() {
    return position.getText() + "_" + port.getText();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    ColumnTag columnTag = (ColumnTag) o;
    return position == columnTag.position && port == columnTag.port;
  }

  @Override
  public int hashCode() {
    return Objects.hash(position, port);
  }

  @Override
  public String toString() {
    return toText();
  }
}
