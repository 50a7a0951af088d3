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

package com.twentyn.sfiles.parser;

import com.twentyn.sfiles.AmbiguousHeatIntegrationException;
import com.twentyn.sfiles.MalformedTopologyException;
import com.twentyn.sfiles.graph.EdgeKind;
import com.twentyn.sfiles.graph.EdgeTags;
import com.twentyn.sfiles.graph.Flowsheet;
import com.twentyn.sfiles.heatintegration.HeatIntegrationNormalizer;
import com.twentyn.sfiles.syntax.Token;
import com.twentyn.sfiles.syntax.TokenKind;
import com.twentyn.sfiles.syntax.UnitLabel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a token sequence into a flowsheet.
 *
 * The builder walks the tokens once with a cursor on the last unit of the current line and a stack of branch
 * contexts.  Units are collected with their literal labels first and only numbered once the whole text has been
 * read, since a generalized string may leave numbers out altogether.
 */
public class GraphBuilder {
  private static final Logger LOGGER = LogManager.getFormatterLogger(GraphBuilder.class);

  private final List<Token> tokens;

  private final List<PendingUnit> units = new ArrayList<>();
  private final List<PendingStream> streams = new ArrayList<>();

  private Integer cursor = null;
  private List<PendingStream> pendingJoins = new ArrayList<>();
  private final Deque<Frame> frames = new ArrayDeque<>();
  private final Map<Integer, PendingMarker> openCycles = new HashMap<>();
  private final Map<Integer, PendingMarker> openSignals = new HashMap<>();

  // The stream a tag block would describe right now, if any.
  private PendingStream taggable = null;

  private GraphBuilder(List<Token> tokens) {
    this.tokens = tokens;
  }

  /**
   * Builds a flowsheet from tokens.
   *
   * @param tokens Tokens as produced by the tokenizer.
   * @return The flowsheet, numbered by first appearance of each unit.
   * @throws MalformedTopologyException if the tokens do not describe a consistent graph.
   * @throws AmbiguousHeatIntegrationException if the heat integration tags cannot be paired.
   */
  public static Flowsheet build(List<Token> tokens)
      throws MalformedTopologyException, AmbiguousHeatIntegrationException {
    GraphBuilder builder = new GraphBuilder(tokens);
    builder.walk();
    Flowsheet flowsheet = builder.materialize();
    HeatIntegrationNormalizer.validate(flowsheet);
    LOGGER.debug("Built flowsheet with %d units and %d streams", flowsheet.size(), flowsheet.getStreams().size());
    return flowsheet;
  }

  private void walk() throws MalformedTopologyException {
    for (Token t : tokens) {
      switch (t.getKind()) {
        case NODE:
          onUnit(t);
          break;
        case BRANCH_OPEN:
          requireNoPendingJoins(t);
          if (cursor == null) {
            throw new MalformedTopologyException("A branch needs a unit to start from", t.getOffset());
          }
          frames.push(new Frame(TokenKind.BRANCH_OPEN, cursor, pendingJoins));
          pendingJoins = new ArrayList<>();
          taggable = null;
          break;
        case BRANCH_CLOSE:
          requireNoPendingJoins(t);
          Frame branch = popFrame(TokenKind.BRANCH_OPEN, t);
          cursor = branch.cursor;
          pendingJoins = branch.pendingJoins;
          taggable = null;
          break;
        case INCOMING_BRANCH_OPEN:
          frames.push(new Frame(TokenKind.INCOMING_BRANCH_OPEN, cursor, pendingJoins));
          cursor = null;
          pendingJoins = new ArrayList<>();
          taggable = null;
          break;
        case INCOMING_BRANCH_CLOSE:
          requireNoPendingJoins(t);
          Frame incoming = popFrame(TokenKind.INCOMING_BRANCH_OPEN, t);
          if (cursor == null) {
            throw new MalformedTopologyException("An incoming branch must contain a unit", t.getOffset());
          }
          PendingStream join = new PendingStream(cursor, null, EdgeKind.MATERIAL);
          cursor = incoming.cursor;
          pendingJoins = incoming.pendingJoins;
          pendingJoins.add(join);
          taggable = join;
          break;
        case CYCLE_OPEN:
        case CYCLE_CLOSE:
          onMarker(t, openCycles, EdgeKind.MATERIAL);
          break;
        case SIGNAL_OPEN:
        case SIGNAL_CLOSE:
          onMarker(t, openSignals, EdgeKind.SIGNAL);
          break;
        case TAG_BLOCK:
          if (taggable == null) {
            throw new MalformedTopologyException("Tag block does not follow a stream it could describe", t.getOffset());
          }
          for (String entry : t.getTagEntries()) {
            taggable.tags.addEntry(entry);
          }
          break;
        case COMPONENT_SEPARATOR:
          requireNoPendingJoins(t);
          cursor = null;
          taggable = null;
          break;
        default:
          throw new IllegalStateException("Unhandled token kind " + t.getKind());
      }
    }

    if (!frames.isEmpty()) {
      throw new MalformedTopologyException("Unbalanced branch at end of input");
    }
    if (!pendingJoins.isEmpty()) {
      throw new MalformedTopologyException("Incoming branch at end of input does not join a unit");
    }
    requireAllPaired(openCycles, "Recycle");
    requireAllPaired(openSignals, "Signal");
  }

  private void requireAllPaired(Map<Integer, PendingMarker> open, String what) throws MalformedTopologyException {
    if (open.isEmpty()) {
      return;
    }
    Map.Entry<Integer, PendingMarker> entry = open.entrySet().iterator().next();
    throw new MalformedTopologyException(
        String.format("%s marker %s is never paired", what, Token.formatIndex(entry.getKey())),
        entry.getValue().offset);
  }

  private void onUnit(Token t) {
    UnitLabel label = UnitLabel.parse(t.getText());
    if (label == null) {
      // The tokenizer only hands out valid labels.
      throw new IllegalStateException("Invalid unit token " + t);
    }
    int unit = units.size();
    units.add(new PendingUnit(label, t.getOffset()));

    taggable = null;
    if (cursor != null) {
      PendingStream main = new PendingStream(cursor, unit, EdgeKind.MATERIAL);
      streams.add(main);
      taggable = main;
    }
    for (PendingStream join : pendingJoins) {
      join.target = unit;
      streams.add(join);
    }
    pendingJoins = new ArrayList<>();
    cursor = unit;
  }

  /**
   * Markers pair up by number.  The receiving end ('<n', '<_n') is the target of the resulting stream, the other end
   * its source; either end may come first.
   */
  private void onMarker(Token t, Map<Integer, PendingMarker> open, EdgeKind kind) throws MalformedTopologyException {
    if (cursor == null) {
      throw new MalformedTopologyException("Marker does not follow a unit", t.getOffset());
    }
    boolean receiving = t.getKind().isReceivingMarker();
    PendingMarker first = open.get(t.getIndex());
    if (first == null) {
      PendingStream stream = receiving ?
          new PendingStream(null, cursor, kind) : new PendingStream(cursor, null, kind);
      open.put(t.getIndex(), new PendingMarker(stream, receiving, t.getOffset()));
      taggable = stream;
      return;
    }
    if (first.receiving == receiving) {
      throw new MalformedTopologyException(
          String.format("Marker %s is already in use", t.toText()), t.getOffset());
    }
    open.remove(t.getIndex());
    PendingStream stream = first.stream;
    if (receiving) {
      stream.target = cursor;
    } else {
      stream.source = cursor;
    }
    streams.add(stream);
    taggable = stream;
  }

  private void requireNoPendingJoins(Token t) throws MalformedTopologyException {
    if (!pendingJoins.isEmpty()) {
      throw new MalformedTopologyException("An incoming branch must be followed by the unit it joins", t.getOffset());
    }
  }

  private Frame popFrame(TokenKind opener, Token t) throws MalformedTopologyException {
    if (frames.isEmpty() || frames.peek().opener != opener) {
      throw new MalformedTopologyException(String.format("Unmatched '%s'", t.toText()), t.getOffset());
    }
    return frames.pop();
  }

  /**
   * Numbers units per type in order of first appearance.  Literal numbers are only labels: tokens sharing a label
   * are sub-nodes of one unit, and sub-node labels are renumbered per family in order of first appearance.
   */
  private Flowsheet materialize() throws MalformedTopologyException {
    Map<String, Integer> nextIndex = new HashMap<>();
    Map<String, Integer> labelIndex = new HashMap<>();
    Map<String, Boolean> labelIsFamily = new HashMap<>();
    Map<String, Map<Integer, Integer>> subLabels = new HashMap<>();

    Flowsheet flowsheet = new Flowsheet();
    for (PendingUnit u : units) {
      UnitLabel label = u.label;
      String type = label.getType();
      if (!label.isNumbered()) {
        flowsheet.addUnit(type, nextIndex.merge(type, 1, Integer::sum));
        continue;
      }

      String key = type + "-" + label.getIndex();
      boolean isFamily = label.getSubIndex() != null;
      Boolean seenAsFamily = labelIsFamily.get(key);
      if (seenAsFamily != null && (!seenAsFamily || !isFamily)) {
        throw new MalformedTopologyException(String.format("Unit %s appears more than once", label.toText()), u.offset);
      }
      labelIsFamily.put(key, isFamily);
      Integer index = labelIndex.get(key);
      if (index == null) {
        index = nextIndex.merge(type, 1, Integer::sum);
        labelIndex.put(key, index);
      }
      if (!isFamily) {
        flowsheet.addUnit(type, index);
        continue;
      }

      Map<Integer, Integer> subs = subLabels.computeIfAbsent(key, k -> new HashMap<>());
      if (subs.containsKey(label.getSubIndex())) {
        throw new MalformedTopologyException(String.format("Unit %s appears more than once", label.toText()), u.offset);
      }
      int subIndex = subs.size() + 1;
      subs.put(label.getSubIndex(), subIndex);
      flowsheet.addUnit(type, index, subIndex);
    }

    // Pending units and flowsheet units share positions, so pending ids are flowsheet ids.
    for (PendingStream s : streams) {
      flowsheet.addStream(s.source, s.target, s.kind, s.tags.build());
    }
    return flowsheet;
  }

  private static class PendingUnit {
    final UnitLabel label;
    final int offset;

    PendingUnit(UnitLabel label, int offset) {
      this.label = label;
      this.offset = offset;
    }
  }

  private static class PendingStream {
    Integer source;
    Integer target;
    final EdgeKind kind;
    final EdgeTags.Builder tags = EdgeTags.builder();

    PendingStream(Integer source, Integer target, EdgeKind kind) {
      this.source = source;
      this.target = target;
      this.kind = kind;
    }
  }

  private static class PendingMarker {
    final PendingStream stream;
    final boolean receiving;
    final int offset;

    PendingMarker(PendingStream stream, boolean receiving, int offset) {
      this.stream = stream;
      this.receiving = receiving;
      this.offset = offset;
    }
  }

  private static class Frame {
    final TokenKind opener;
    final Integer cursor;
    final List<PendingStream> pendingJoins;

    Frame(TokenKind opener, Integer cursor, List<PendingStream> pendingJoins) {
      this.opener = opener;
      this.cursor = cursor;
      this.pendingJoins = pendingJoins;
    }
  }
}
