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

import com.twentyn.sfiles.AmbiguousHeatIntegrationException;
import com.twentyn.sfiles.EncoderOptions;
import com.twentyn.sfiles.SfilesVersion;
import com.twentyn.sfiles.UnencodableGraphException;
import com.twentyn.sfiles.graph.EdgeKind;
import com.twentyn.sfiles.graph.Flowsheet;
import com.twentyn.sfiles.graph.StreamEdge;
import com.twentyn.sfiles.graph.UnitNode;
import com.twentyn.sfiles.heatintegration.HeatIntegrationNormalizer;
import com.twentyn.sfiles.syntax.Token;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Writes a flowsheet as SFILES text.
 *
 * Each weakly connected component is written as a depth-first traversal starting from a unit without incoming
 * material streams.  At every step the next unit is the unvisited successor that sorts first; the others become
 * branches.  Streams back into the part already written become recycle markers, and a further start unit whose line
 * ends in the part already written becomes an incoming branch in front of the unit it joins.  Signal lines are added
 * once all material streams are placed.
 *
 * In canonical mode candidates are ordered by invariant rank, then by the text the candidate would produce if it were
 * taken next, then by its tags, and finally by the numbering of {@link CanonicalLabeler}, so the output does not
 * depend on how the flowsheet was built.  The lookahead text is one level deep: inside it, candidates skip the
 * lookahead step.  Without canonical mode units are taken in id order, the highest id being the main line, which
 * reproduces the order a parsed flowsheet was written in.
 */
public class CanonicalEncoder {
  private static final Logger LOGGER = LogManager.getFormatterLogger(CanonicalEncoder.class);

  private final EncoderOptions options;
  private final InvariantRanker ranker = new InvariantRanker();

  public CanonicalEncoder(EncoderOptions options) {
    this.options = options;
  }

  /**
   * Encodes a flowsheet as SFILES text.
   *
   * @param flowsheet The flowsheet to encode; it is not modified.
   * @return The SFILES string.
   * @throws UnencodableGraphException if the flowsheet has no valid SFILES form.
   * @throws AmbiguousHeatIntegrationException if the heat integration tags do not pair up.
   */
  public String encode(Flowsheet flowsheet) throws UnencodableGraphException, AmbiguousHeatIntegrationException {
    return Token.render(encodeTokens(flowsheet));
  }

  public List<Token> encodeTokens(Flowsheet flowsheet)
      throws UnencodableGraphException, AmbiguousHeatIntegrationException {
    Flowsheet prepared = prepare(flowsheet);
    List<Token> tokens = new Traversal(prepared).run();
    LOGGER.debug("Encoded %d units and %d streams as %d tokens",
        prepared.size(), prepared.getStreams().size(), tokens.size());
    return tokens;
  }

  private Flowsheet prepare(Flowsheet flowsheet) throws UnencodableGraphException, AmbiguousHeatIntegrationException {
    Set<List<Integer>> seen = new HashSet<>();
    for (StreamEdge e : flowsheet.getStreams()) {
      if (!seen.add(Arrays.asList(e.getSource(), e.getTarget(), e.getKind().ordinal()))) {
        throw new UnencodableGraphException(String.format(
            "More than one %s stream from %s to %s", e.getKind().name().toLowerCase(),
            flowsheet.getUnit(e.getSource()).getName(), flowsheet.getUnit(e.getTarget()).getName()));
      }
    }
    HeatIntegrationNormalizer.validate(flowsheet);

    if (options.getVersion() == SfilesVersion.V1 &&
        flowsheet.getUnits().stream().anyMatch(u -> HeatIntegrationNormalizer.isMultiStream(flowsheet, u))) {
      LOGGER.info("Splitting multi-stream heat exchangers for %s output", options.getVersion());
      return HeatIntegrationNormalizer.split(flowsheet);
    }
    return flowsheet;
  }

  /**
   * State of one encode call.
   */
  private class Traversal {
    private final Flowsheet flowsheet;
    private final int[] ranks;
    private final int[] labels;
    private final List<List<StreamEdge>> materialOut;

    Traversal(Flowsheet flowsheet) {
      this.flowsheet = flowsheet;
      this.ranks = options.isCanonical() ? ranker.rank(flowsheet) : null;
      this.labels = options.isCanonical() ? new CanonicalLabeler(flowsheet).label(ranks) : null;
      this.materialOut = new ArrayList<>(flowsheet.size());
      for (int i = 0; i < flowsheet.size(); i++) {
        materialOut.add(flowsheet.getOutStreams(i, EdgeKind.MATERIAL));
      }
    }

    List<Token> run() throws UnencodableGraphException {
      List<ComponentPlan> components = new ArrayList<>();
      for (List<Integer> component : components()) {
        components.add(planComponent(component));
      }
      if (options.isCanonical()) {
        components.sort(Comparator.<ComponentPlan>comparingInt(c -> c.minSourceRank)
            .thenComparing(c -> c.text)
            .thenComparingInt(c -> c.minLabel));
      }

      List<List<Plan.Element>> lines = new ArrayList<>();
      components.forEach(c -> lines.addAll(c.lines));
      addSignals(lines);
      return PlanRenderer.render(flowsheet, options, lines);
    }

    /**
     * Weakly connected components over material streams, each as ascending unit ids, ordered by their lowest id.
     */
    private List<List<Integer>> components() {
      int n = flowsheet.size();
      int[] parent = new int[n];
      for (int i = 0; i < n; i++) {
        parent[i] = i;
      }
      for (StreamEdge e : flowsheet.getStreams(EdgeKind.MATERIAL)) {
        int a = find(parent, e.getSource());
        int b = find(parent, e.getTarget());
        if (a != b) {
          parent[Math.max(a, b)] = Math.min(a, b);
        }
      }
      Map<Integer, List<Integer>> byRoot = new HashMap<>();
      List<List<Integer>> components = new ArrayList<>();
      for (int i = 0; i < n; i++) {
        List<Integer> component = byRoot.get(find(parent, i));
        if (component == null) {
          component = new ArrayList<>();
          byRoot.put(find(parent, i), component);
          components.add(component);
        }
        component.add(i);
      }
      return components;
    }

    private int find(int[] parent, int i) {
      while (parent[i] != i) {
        parent[i] = parent[parent[i]];
        i = parent[i];
      }
      return i;
    }

    private ComponentPlan planComponent(List<Integer> component) throws UnencodableGraphException {
      List<Integer> sources = new ArrayList<>();
      for (int u : component) {
        if (flowsheet.getInStreams(u, EdgeKind.MATERIAL).isEmpty()) {
          sources.add(u);
        }
      }
      if (sources.isEmpty()) {
        UnitNode firstUnit = component.stream().map(flowsheet::getUnit).min(UnitNode.NUMERIC_ORDER).get();
        throw new UnencodableGraphException(String.format(
            "The part of the flowsheet containing %s has no unit without incoming material streams",
            firstUnit.getName()));
      }

      State state = new State(flowsheet.size());
      sources.sort(unitOrder(state));

      List<List<Plan.Element>> lines = new ArrayList<>();
      for (int source : sources) {
        startLine(state, source, lines);
      }
      // Units only a cycle without a source of its own leads to.
      List<Integer> rest = unvisited(state, component);
      while (!rest.isEmpty()) {
        rest.sort(unitOrder(state));
        LOGGER.debug("Starting a line at %s, which no source reaches", flowsheet.getUnit(rest.get(0)).getName());
        startLine(state, rest.get(0), lines);
        rest = unvisited(state, component);
      }

      ComponentPlan plan = new ComponentPlan();
      plan.lines = lines;
      plan.minLabel = options.isCanonical() ? component.stream().mapToInt(u -> labels[u]).min().getAsInt() : 0;
      plan.minSourceRank = options.isCanonical() ? sources.stream().mapToInt(s -> ranks[s]).min().getAsInt() : 0;
      plan.text = options.isCanonical() ? PlanRenderer.renderText(flowsheet, options, lines) : "";
      return plan;
    }

    private void startLine(State state, int unit, List<List<Plan.Element>> lines) {
      BitSet before = (BitSet) state.visited.clone();
      List<Plan.Element> line = new ArrayList<>();
      visit(state, unit, null, line);
      if (lines.isEmpty() || !joinAsIncoming(state, before, line)) {
        lines.add(line);
      }
    }

    private List<Integer> unvisited(State state, List<Integer> component) {
      List<Integer> rest = new ArrayList<>();
      for (int u : component) {
        if (!state.visited.get(u)) {
          rest.add(u);
        }
      }
      return rest;
    }

    /**
     * Turns a line into an incoming branch if its last unit feeds a unit written before the line started.
     */
    private boolean joinAsIncoming(State state, BitSet before, List<Plan.Element> line) {
      Plan.Unit last = null;
      for (int i = line.size() - 1; i >= 0 && last == null; i--) {
        if (line.get(i) instanceof Plan.Unit) {
          last = (Plan.Unit) line.get(i);
        }
      }
      if (last == null) {
        return false;
      }
      Plan.Marker join = null;
      for (Plan.Marker m : last.markers) {
        if (!m.receiving && m.edge.isMaterial() && !m.edge.isSelfLoop() && before.get(m.edge.getTarget())) {
          join = m;
          break;
        }
      }
      if (join == null) {
        return false;
      }
      StreamEdge edge = join.edge;
      last.markers.remove(join);
      Plan.Unit target = state.emissions.get(edge.getTarget());
      target.markers.removeIf(m -> m.receiving && m.edge.equals(edge));
      target.incoming.add(new Plan.Incoming(line, edge));
      return true;
    }

    private void visit(State state, int unit, StreamEdge entry, List<Plan.Element> out) {
      state.visited.set(unit);
      state.visitSeq[unit] = state.nextSeq++;
      Plan.Unit emission = new Plan.Unit(flowsheet.getUnit(unit), entry);
      state.emissions.put(unit, emission);
      out.add(emission);

      List<StreamEdge> back = new ArrayList<>();
      List<StreamEdge> forward = new ArrayList<>();
      for (StreamEdge e : materialOut.get(unit)) {
        (state.visited.get(e.getTarget()) ? back : forward).add(e);
      }
      back.sort(Comparator.comparingInt(e -> state.visitSeq[e.getTarget()]));
      back.forEach(e -> addRecycle(state, e));
      if (forward.isEmpty()) {
        return;
      }

      forward.sort(streamOrder(state));
      if (!options.isCanonical()) {
        // Parsed branches are numbered before the main line they leave from.
        Collections.rotate(forward, 1);
      }
      for (StreamEdge e : forward.subList(1, forward.size())) {
        if (state.visited.get(e.getTarget())) {
          addRecycle(state, e);
        } else {
          List<Plan.Element> body = new ArrayList<>();
          out.add(new Plan.Branch(body));
          visit(state, e.getTarget(), e, body);
        }
      }
      StreamEdge main = forward.get(0);
      if (state.visited.get(main.getTarget())) {
        addRecycle(state, main);
      } else {
        visit(state, main.getTarget(), main, out);
      }
    }

    /**
     * A target outside the current lookahead has no emission yet; only the sending end is recorded then.
     */
    private void addRecycle(State state, StreamEdge e) {
      Plan.Unit target = state.emissions.get(e.getTarget());
      if (target != null) {
        target.markers.add(new Plan.Marker(e, true));
      }
      state.emissions.get(e.getSource()).markers.add(new Plan.Marker(e, false));
    }

    /**
     * Orders units that could be written next.  Ties on rank are broken by what each unit would lead to, then by the
     * canonical numbering.
     */
    private Comparator<Integer> unitOrder(State state) {
      if (!options.isCanonical()) {
        return Comparator.naturalOrder();
      }
      return invariantOrder(state).thenComparingInt(u -> labels[u]);
    }

    /**
     * Orders streams to unvisited units like their targets, except that the streams' tags are compared before the
     * canonical numbering.
     */
    private Comparator<StreamEdge> streamOrder(State state) {
      if (!options.isCanonical()) {
        return Comparator.comparingInt(StreamEdge::getTarget);
      }
      Comparator<Integer> targets = invariantOrder(state);
      return Comparator.<StreamEdge, Integer>comparing(StreamEdge::getTarget, targets)
          .thenComparingInt(e -> e.getTags().size())
          .thenComparing(e -> PlanRenderer.maskedTags(e.getTags()))
          .thenComparingInt(e -> labels[e.getTarget()]);
    }

    /**
     * Lookahead texts are computed once per candidate and sort; a speculative walk compares by rank only.
     */
    private Comparator<Integer> invariantOrder(State state) {
      Comparator<Integer> byRank = Comparator.comparingInt(u -> ranks[u]);
      if (state.speculative) {
        return byRank;
      }
      Map<Integer, String> lookaheads = new HashMap<>();
      return byRank.thenComparing(u -> lookaheads.computeIfAbsent(u, k -> lookahead(state, k)));
    }

    private String lookahead(State state, int unit) {
      State speculative = state.copy();
      List<Plan.Element> line = new ArrayList<>();
      visit(speculative, unit, null, line);
      List<List<Plan.Element>> lines = new ArrayList<>();
      lines.add(line);
      return PlanRenderer.renderText(flowsheet, options, lines);
    }

    /**
     * Signal markers are placed by where their endpoints ended up in the material layout.
     */
    private void addSignals(List<List<Plan.Element>> lines) {
      List<StreamEdge> signals = new ArrayList<>(flowsheet.getStreams(EdgeKind.SIGNAL));
      if (signals.isEmpty()) {
        return;
      }
      Map<Integer, Plan.Unit> emissions = new HashMap<>();
      int[] position = new int[flowsheet.size()];
      for (List<Plan.Element> line : lines) {
        index(line, emissions, position);
      }
      signals.sort(Comparator.<StreamEdge>comparingInt(e -> position[e.getSource()])
          .thenComparingInt(e -> position[e.getTarget()]));
      for (StreamEdge e : signals) {
        Plan.Unit source = emissions.get(e.getSource());
        Plan.Unit target = emissions.get(e.getTarget());
        if (e.isSelfLoop()) {
          source.markers.add(new Plan.Marker(e, true));
          source.markers.add(new Plan.Marker(e, false));
        } else {
          source.markers.add(new Plan.Marker(e, false));
          target.markers.add(new Plan.Marker(e, true));
        }
      }
    }

    private void index(List<Plan.Element> line, Map<Integer, Plan.Unit> emissions, int[] position) {
      for (Plan.Element element : line) {
        if (element instanceof Plan.Branch) {
          index(((Plan.Branch) element).body, emissions, position);
          continue;
        }
        Plan.Unit emission = (Plan.Unit) element;
        for (Plan.Incoming incoming : emission.incoming) {
          index(incoming.line, emissions, position);
        }
        position[emission.unit.getId()] = emissions.size();
        emissions.put(emission.unit.getId(), emission);
      }
    }
  }

  private static class State {
    final BitSet visited;
    final int[] visitSeq;
    int nextSeq;
    final Map<Integer, Plan.Unit> emissions;
    final boolean speculative;

    State(int size) {
      this(new BitSet(size), new int[size], 0, new HashMap<>(), false);
    }

    private State(BitSet visited, int[] visitSeq, int nextSeq, Map<Integer, Plan.Unit> emissions,
                  boolean speculative) {
      this.visited = visited;
      this.visitSeq = visitSeq;
      this.nextSeq = nextSeq;
      this.emissions = emissions;
      this.speculative = speculative;
    }

    // Emissions are not copied: a speculative walk must not add markers to units already written.
    State copy() {
      return new State((BitSet) visited.clone(), visitSeq.clone(), nextSeq, new HashMap<>(), true);
    }
  }

  private static class ComponentPlan {
    List<List<Plan.Element>> lines;
    int minSourceRank;
    String text;
    int minLabel;
  }
}
