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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A process flowsheet: an arena of units and the streams between them.  Units and streams are addressed by the small
 * integer ids handed out when they are added, in insertion order.  A flowsheet may consist of several disconnected
 * parts.
 *
 * Units and streams are never removed; transformations such as heat integration merging build a new flowsheet.
 */
public class Flowsheet {

  private final List<UnitNode> units = new ArrayList<>();
  private final List<StreamEdge> streams = new ArrayList<>();

  private final Map<String, UnitNode> nameIndex = new HashMap<>();
  // Families that were registered as whole units (false) or as sub-node families (true).
  private final Map<String, Boolean> familyIsSplit = new HashMap<>();
  private final List<List<StreamEdge>> outStreams = new ArrayList<>();
  private final List<List<StreamEdge>> inStreams = new ArrayList<>();

  public Flowsheet() {
  }

  public UnitNode addUnit(String type, int index) {
    return addUnit(type, index, null);
  }

  /**
   * Adds a unit to the flowsheet.
   *
   * @param type The unit operation code, e.g. "hex".
   * @param index The unit's number, unique per type.
   * @param subIndex The stream pair number for heat exchanger sub-nodes, or null for whole units.
   * @return The new unit.
   * @throws IllegalArgumentException if the name is taken, or if a family would contain both a whole unit and
   * sub-nodes.
   */
  public UnitNode addUnit(String type, int index, Integer subIndex) {
    UnitNode unit = new UnitNode(units.size(), type, index, subIndex);
    if (nameIndex.containsKey(unit.getName())) {
      throw new IllegalArgumentException(String.format("Flowsheet already contains unit %s", unit.getName()));
    }
    Boolean split = familyIsSplit.get(unit.getFamilyName());
    if (split != null && split != unit.isSubNode()) {
      throw new IllegalArgumentException(
          String.format("Unit %s cannot be both a whole unit and a family of sub-nodes", unit.getFamilyName()));
    }

    familyIsSplit.put(unit.getFamilyName(), unit.isSubNode());
    nameIndex.put(unit.getName(), unit);
    units.add(unit);
    outStreams.add(new ArrayList<>());
    inStreams.add(new ArrayList<>());
    return unit;
  }

  public StreamEdge addStream(UnitNode source, UnitNode target) {
    return addStream(source.getId(), target.getId(), EdgeKind.MATERIAL, EdgeTags.EMPTY);
  }

  public StreamEdge addStream(UnitNode source, UnitNode target, EdgeTags tags) {
    return addStream(source.getId(), target.getId(), EdgeKind.MATERIAL, tags);
  }

  public StreamEdge addSignal(UnitNode source, UnitNode target) {
    return addStream(source.getId(), target.getId(), EdgeKind.SIGNAL, EdgeTags.EMPTY);
  }

  /**
   * Adds a stream between two units of this flowsheet.  Several streams of the same kind between the same ordered
   * pair are representable here, but cannot be encoded.
   */
  public StreamEdge addStream(int source, int target, EdgeKind kind, EdgeTags tags) {
    checkUnitId(source);
    checkUnitId(target);
    StreamEdge edge = new StreamEdge(streams.size(), source, target, kind, tags);
    streams.add(edge);
    outStreams.get(source).add(edge);
    inStreams.get(target).add(edge);
    return edge;
  }

  private void checkUnitId(int id) {
    if (id < 0 || id >= units.size()) {
      throw new IllegalArgumentException(String.format("Flowsheet has no unit with id %d", id));
    }
  }

  public int size() {
    return units.size();
  }

  public List<UnitNode> getUnits() {
    return Collections.unmodifiableList(units);
  }

  public List<StreamEdge> getStreams() {
    return Collections.unmodifiableList(streams);
  }

  public List<StreamEdge> getStreams(EdgeKind kind) {
    return streams.stream().filter(e -> e.getKind() == kind).collect(Collectors.toList());
  }

  public UnitNode getUnit(int id) {
    checkUnitId(id);
    return units.get(id);
  }

  public UnitNode getUnitByName(String name) {
    UnitNode result = nameIndex.get(name);
    if (result == null) {
      throw new IllegalArgumentException(String.format("Didn't find unit %s", name));
    }
    return result;
  }

  public Optional<UnitNode> findUnit(String name) {
    return Optional.ofNullable(nameIndex.get(name));
  }

  public List<StreamEdge> getOutStreams(int id) {
    checkUnitId(id);
    return Collections.unmodifiableList(outStreams.get(id));
  }

  public List<StreamEdge> getInStreams(int id) {
    checkUnitId(id);
    return Collections.unmodifiableList(inStreams.get(id));
  }

  public List<StreamEdge> getOutStreams(int id, EdgeKind kind) {
    return getOutStreams(id).stream().filter(e -> e.getKind() == kind).collect(Collectors.toList());
  }

  public List<StreamEdge> getInStreams(int id, EdgeKind kind) {
    return getInStreams(id).stream().filter(e -> e.getKind() == kind).collect(Collectors.toList());
  }

  /**
   * Get the units that are sub-nodes of the given family, in insertion order.
   *
   * @param familyName A "type-index" name.
   * @return The sub-nodes, empty if the family is a whole unit or unknown.
   */
  public List<UnitNode> getSubNodes(String familyName) {
    return units.stream()
        .filter(u -> u.isSubNode() && u.getFamilyName().equals(familyName))
        .collect(Collectors.toList());
  }

  @Override
  public String toString() {
    return String.format("Flowsheet[%d units, %d streams]", units.size(), streams.size());
  }
}
