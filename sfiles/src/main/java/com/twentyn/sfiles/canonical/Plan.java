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

package com.twentyn.sfiles.canonical;

import com.twentyn.sfiles.graph.StreamEdge;
import com.twentyn.sfiles.graph.UnitNode;

import java.util.ArrayList;
import java.util.List;

/**
 * The shape of an encoding before numbers are handed out.  A traversal appends to a line of elements; recycle and
 * signal markers and incoming branches are attached to the units they belong to, possibly after the unit was first
 * written, and only get their final text when the whole plan is rendered.
 */
final class Plan {

  private Plan() {
  }

  interface Element {
  }

  static final class Unit implements Element {
    final UnitNode unit;
    // The stream this unit was reached by, or null at the start of a line.
    final StreamEdge entry;
    final List<Incoming> incoming = new ArrayList<>();
    final List<Marker> markers = new ArrayList<>();

    Unit(UnitNode unit, StreamEdge entry) {
      this.unit = unit;
      this.entry = entry;
    }
  }

  static final class Branch implements Element {
    final List<Element> body;

    Branch(List<Element> body) {
      this.body = body;
    }
  }

  /**
   * A line written in front of the unit it flows into; join is the stream from its last unit to that unit.
   */
  static final class Incoming {
    final List<Element> line;
    final StreamEdge join;

    Incoming(List<Element> line, StreamEdge join) {
      this.line = line;
      this.join = join;
    }
  }

  /**
   * One end of a recycle or signal line.  The receiving end sits on the stream's target, the sending end on its
   * source and carries the stream's tags.
   */
  static final class Marker {
    final StreamEdge edge;
    final boolean receiving;

    Marker(StreamEdge edge, boolean receiving) {
      this.edge = edge;
      this.receiving = receiving;
    }
  }
}
