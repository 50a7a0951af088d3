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

import com.twentyn.sfiles.EncoderOptions;
import com.twentyn.sfiles.UnencodableGraphException;
import com.twentyn.sfiles.graph.EdgeKind;
import com.twentyn.sfiles.graph.EdgeTags;
import com.twentyn.sfiles.graph.Flowsheet;
import com.twentyn.sfiles.graph.HeatIntegrationTag;
import com.twentyn.sfiles.graph.StreamEdge;
import com.twentyn.sfiles.graph.UnitNode;
import com.twentyn.sfiles.heatintegration.HeatIntegrationNormalizer;
import com.twentyn.sfiles.syntax.Token;
import com.twentyn.sfiles.syntax.TokenKind;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a plan out as tokens.  Everything that depends on the order of appearance is decided here: marker numbers,
 * sub-node labels and numbered heat integration stream ids.  Each render starts from scratch, so a partial plan
 * renders the same way wherever in the flowsheet it was taken from.
 */
class PlanRenderer {
  static final int MAX_MARKER_INDEX = 99;

  private final Flowsheet flowsheet;
  private final EncoderOptions options;
  private final List<Token> tokens = new ArrayList<>();

  private final MarkerPool cycles = new MarkerPool();
  private final MarkerPool signals = new MarkerPool();
  private final Map<String, Integer> familyLabels = new HashMap<>();
  private final Map<String, Integer> familyCounters = new HashMap<>();
  private final Map<String, Map<Integer, Integer>> subLabels = new HashMap<>();
  private final Map<String, Map<String, String>> streamLabels = new HashMap<>();

  private PlanRenderer(Flowsheet flowsheet, EncoderOptions options) {
    this.flowsheet = flowsheet;
    this.options = options;
  }

  /**
   * Renders complete lines, separated by component separators.
   *
   * @throws UnencodableGraphException if more markers would be open at once than can be numbered.
   */
  static List<Token> render(Flowsheet flowsheet, EncoderOptions options, List<List<Plan.Element>> lines)
      throws UnencodableGraphException {
    PlanRenderer renderer = new PlanRenderer(flowsheet, options);
    renderer.renderLines(lines);
    if (renderer.cycles.overflowed || renderer.signals.overflowed) {
      throw new UnencodableGraphException(String.format(
          "More than %d recycle or signal lines would be open at the same time", MAX_MARKER_INDEX));
    }
    return renderer.tokens;
  }

  /**
   * Renders lines to text for comparison only.  Marker numbers past the limit are written as they come.
   */
  static String renderText(Flowsheet flowsheet, EncoderOptions options, List<List<Plan.Element>> lines) {
    PlanRenderer renderer = new PlanRenderer(flowsheet, options);
    renderer.renderLines(lines);
    return Token.render(renderer.tokens);
  }

  /**
   * Tag text with numbered stream ids blanked out, so it can be compared before ids are relabeled.
   */
  static String maskedTags(EdgeTags tags) {
    List<String> entries = new ArrayList<>(tags.size());
    for (HeatIntegrationTag t : tags.getHeatIntegration()) {
      entries.add(t.isNumbered() ? "#_" + t.getPort().getText() : t.toText());
    }
    tags.getColumn().forEach(t -> entries.add(t.toText()));
    tags.getSignal().forEach(t -> entries.add(t.toText()));
    entries.addAll(tags.getOther());
    return String.join(Token.TAG_ENTRY_SEPARATOR, entries);
  }

  private void renderLines(List<List<Plan.Element>> lines) {
    for (int i = 0; i < lines.size(); i++) {
      if (i > 0) {
        tokens.add(Token.symbol(TokenKind.COMPONENT_SEPARATOR, -1));
      }
      renderLine(lines.get(i));
    }
  }

  private void renderLine(List<Plan.Element> line) {
    for (Plan.Element element : line) {
      if (element instanceof Plan.Branch) {
        tokens.add(Token.symbol(TokenKind.BRANCH_OPEN, -1));
        renderLine(((Plan.Branch) element).body);
        tokens.add(Token.symbol(TokenKind.BRANCH_CLOSE, -1));
      } else {
        renderUnit((Plan.Unit) element);
      }
    }
  }

  private void renderUnit(Plan.Unit emission) {
    for (Plan.Incoming incoming : emission.incoming) {
      tokens.add(Token.symbol(TokenKind.INCOMING_BRANCH_OPEN, -1));
      renderLine(incoming.line);
      tokens.add(Token.symbol(TokenKind.INCOMING_BRANCH_CLOSE, -1));
      renderTags(incoming.join);
    }
    tokens.add(Token.unit(unitText(emission.unit), -1));
    if (emission.entry != null) {
      renderTags(emission.entry);
    }
    for (Plan.Marker marker : emission.markers) {
      boolean signal = marker.edge.getKind() == EdgeKind.SIGNAL;
      int index = (signal ? signals : cycles).take(marker.edge);
      TokenKind kind;
      if (signal) {
        kind = marker.receiving ? TokenKind.SIGNAL_OPEN : TokenKind.SIGNAL_CLOSE;
      } else {
        kind = marker.receiving ? TokenKind.CYCLE_OPEN : TokenKind.CYCLE_CLOSE;
      }
      tokens.add(Token.marker(kind, index, -1));
      if (!marker.receiving) {
        renderTags(marker.edge);
      }
    }
  }

  private void renderTags(StreamEdge edge) {
    if (!options.getVersion().supportsTags() || edge.getTags().isEmpty()) {
      return;
    }
    tokens.add(Token.tagBlock(tagText(flowsheet, edge, streamLabels), -1));
  }

  /**
   * Tag text of a stream with numbered heat integration ids relabeled per exchanger, in the order the given labels
   * first see them.
   */
  static String tagText(Flowsheet flowsheet, StreamEdge edge, Map<String, Map<String, String>> streamLabels) {
    EdgeTags tags = edge.getTags();
    List<String> entries = new ArrayList<>(tags.size());
    for (HeatIntegrationTag t : tags.getHeatIntegration()) {
      if (!t.isNumbered()) {
        entries.add(t.toText());
        continue;
      }
      String exchanger = flowsheet.getUnit(HeatIntegrationNormalizer.exchangerOf(edge, t)).getFamilyName();
      Map<String, String> labels = streamLabels.computeIfAbsent(exchanger, k -> new HashMap<>());
      String label = labels.computeIfAbsent(t.getStream(), k -> Integer.toString(labels.size() + 1));
      entries.add(t.withStream(label).toText());
    }
    tags.getColumn().forEach(t -> entries.add(t.toText()));
    tags.getSignal().forEach(t -> entries.add(t.toText()));
    entries.addAll(tags.getOther());
    return String.join(Token.TAG_ENTRY_SEPARATOR, entries);
  }

  private String unitText(UnitNode unit) {
    if (!unit.isSubNode() || options.isRemoveNumbering()) {
      return unit.getType();
    }
    String family = unit.getFamilyName();
    int group = familyLabels.computeIfAbsent(family,
        k -> familyCounters.merge(unit.getType(), 1, Integer::sum));
    Map<Integer, Integer> subs = subLabels.computeIfAbsent(family, k -> new HashMap<>());
    int sub = subs.computeIfAbsent(unit.getSubIndex(), k -> subs.size() + 1);
    return unit.getType() + "-" + group + "/" + sub;
  }

  /**
   * Hands out the lowest free number when a line opens and frees it again when the line closes.
   */
  private static class MarkerPool {
    private final Map<Integer, Integer> open = new HashMap<>();
    private final BitSet inUse = new BitSet();
    boolean overflowed = false;

    int take(StreamEdge edge) {
      Integer index = open.remove(edge.getId());
      if (index != null) {
        inUse.clear(index);
        return index;
      }
      int next = inUse.nextClearBit(1);
      if (next > MAX_MARKER_INDEX) {
        overflowed = true;
      }
      inUse.set(next);
      open.put(edge.getId(), next);
      return next;
    }
  }
}
