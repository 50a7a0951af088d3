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
 * A directed connection between two units of the same flowsheet, addressed by unit id.
 */
public class StreamEdge {
  private final int id;
  private final int source;
  private final int target;
  private final EdgeKind kind;
  private final EdgeTags tags;

  StreamEdge(int id, int source, int target, EdgeKind kind, EdgeTags tags) {
    if (kind == null || tags == null) {
      throw new IllegalArgumentException("Stream edges need a kind and a (possibly empty) tag record");
    }
    this.id = id;
    this.source = source;
    this.target = target;
    this.kind = kind;
    this.tags = tags;
  }

  public int getId() {
    return id;
  }

  public int getSource() {
    return source;
  }

  public int getTarget() {
    return target;
  }

  public EdgeKind getKind() {
    return kind;
  }

  public EdgeTags getTags() {
    return tags;
  }

  public boolean isMaterial() {
    return kind == EdgeKind.MATERIAL;
  }

  public boolean isSelfLoop() {
    return source == target;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    StreamEdge that = (StreamEdge) o;
    return id == that.id && source == that.source && target == that.target && kind == that.kind &&
        tags.equals(that.tags);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, source, target, kind, tags);
  }

  @Override
  public String toString() {
    return String.format("%d -%s-> %d %s", source, kind == EdgeKind.MATERIAL ? "" : "s", target, tags);
  }
}
