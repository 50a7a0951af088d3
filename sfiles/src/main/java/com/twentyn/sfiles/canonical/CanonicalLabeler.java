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

import com.twentyn.sfiles.graph.Flowsheet;
import com.twentyn.sfiles.graph.StreamEdge;
import com.twentyn.sfiles.graph.UnitNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Numbers the units of a flowsheet so that two flowsheets get the same numbering, up to symmetry, exactly when they
 * are the same flowsheet written down differently.  The encoder uses this numbering wherever rank, lookahead and tags
 * leave candidates tied.
 *
 * Units are first split into classes by invariant rank, type and sub-node form, and the classes are refined by the
 * classes of their upstream, downstream and same-exchanger neighbours, taking stream kinds and tags into account.
 * While a class holds more than one unit, each of its units is in turn set apart and refinement repeats, which yields
 * a search tree whose leaves number every unit.  Each leaf is scored by a certificate: the flowsheet written out in
 * leaf order with heat integration stream ids and exchanger families relabeled by first use.  The leaf with the
 * smallest certificate wins.  Two leaves with equal certificates differ by a symmetry of the flowsheet; such
 * symmetries are kept and used to skip subtrees that are mirror images of ones already searched, as in nauty.
 */
class CanonicalLabeler {
  private static final Logger LOGGER = LogManager.getFormatterLogger(CanonicalLabeler.class);

  private final Flowsheet flowsheet;
  private final int n;
  private final List<List<Integer>> familyMates;

  private final List<int[]> automorphisms = new ArrayList<>();
  private int[] firstLabels;
  private String firstCertificate;
  private int[] bestLabels;
  private String bestCertificate;
  private int leaves = 0;

  CanonicalLabeler(Flowsheet flowsheet) {
    this.flowsheet = flowsheet;
    this.n = flowsheet.size();

    this.familyMates = new ArrayList<>(n);
    for (UnitNode unit : flowsheet.getUnits()) {
      List<Integer> mates = new ArrayList<>();
      if (unit.isSubNode()) {
        flowsheet.getSubNodes(unit.getFamilyName()).stream()
            .filter(mate -> mate.getId() != unit.getId())
            .forEach(mate -> mates.add(mate.getId()));
      }
      familyMates.add(mates);
    }
  }

  /**
   * @param ranks Invariant ranks indexed by unit id; they lead the numbering.
   * @return A numbering 0..n-1 indexed by unit id.
   */
  int[] label(int[] ranks) {
    List<String> keys = new ArrayList<>(n);
    for (UnitNode unit : flowsheet.getUnits()) {
      keys.add(String.format("%08d:%s:%s", ranks[unit.getId()], unit.isSubNode() ? "s" : "w", unit.getType()));
    }
    search(refine(compress(keys)), new ArrayList<>());
    LOGGER.debug("Numbered %d units after %d leaves and %d symmetries", n, leaves, automorphisms.size());
    return bestLabels;
  }

  private void search(int[] colours, List<Integer> prefix) {
    List<Integer> cell = firstSplittableCell(colours);
    if (cell.isEmpty()) {
      leaf(colours);
      return;
    }
    List<Integer> explored = new ArrayList<>();
    for (int unit : cell) {
      if (inExploredOrbit(unit, explored, prefix)) {
        continue;
      }
      explored.add(unit);
      prefix.add(unit);
      search(refine(individualize(colours, unit)), prefix);
      prefix.remove(prefix.size() - 1);
    }
  }

  private List<Integer> firstSplittableCell(int[] colours) {
    int[] counts = new int[n];
    for (int c : colours) {
      counts[c]++;
    }
    for (int c = 0; c < n; c++) {
      if (counts[c] > 1) {
        List<Integer> cell = new ArrayList<>();
        for (int u = 0; u < n; u++) {
          if (colours[u] == c) {
            cell.add(u);
          }
        }
        return cell;
      }
    }
    return Collections.emptyList();
  }

  private int[] individualize(int[] colours, int unit) {
    List<Integer> keys = new ArrayList<>(n);
    for (int u = 0; u < n; u++) {
      boolean pushedBack = u != unit && colours[u] == colours[unit];
      keys.add(2 * colours[u] + (pushedBack ? 1 : 0));
    }
    return compress(keys);
  }

  /**
   * Splits classes by the classes of their neighbours until nothing splits.  A unit's own class leads its key, so the
   * order between classes is kept.
   */
  private int[] refine(int[] colours) {
    int classes = countClasses(colours);
    while (true) {
      List<String> keys = new ArrayList<>(n);
      for (int u = 0; u < n; u++) {
        keys.add(neighbourhoodKey(colours, u));
      }
      int[] refined = compress(keys);
      int refinedClasses = countClasses(refined);
      colours = refined;
      if (refinedClasses == classes) {
        return colours;
      }
      classes = refinedClasses;
    }
  }

  private String neighbourhoodKey(int[] colours, int unit) {
    List<String> out = new ArrayList<>();
    for (StreamEdge e : flowsheet.getOutStreams(unit)) {
      out.add(streamKey(colours[e.getTarget()], e));
    }
    List<String> in = new ArrayList<>();
    for (StreamEdge e : flowsheet.getInStreams(unit)) {
      in.add(streamKey(colours[e.getSource()], e));
    }
    List<String> mates = new ArrayList<>();
    for (int mate : familyMates.get(unit)) {
      mates.add(pad(colours[mate]));
    }
    Collections.sort(out);
    Collections.sort(in);
    Collections.sort(mates);
    return pad(colours[unit]) + ">" + String.join(",", out) + "<" + String.join(",", in) + "=" + String.join(",", mates);
  }

  private static String streamKey(int colour, StreamEdge e) {
    return pad(colour) + e.getKind().name().charAt(0) + PlanRenderer.maskedTags(e.getTags());
  }

  private boolean inExploredOrbit(int unit, List<Integer> explored, List<Integer> prefix) {
    if (explored.isEmpty()) {
      return false;
    }
    int[] parent = new int[n];
    for (int u = 0; u < n; u++) {
      parent[u] = u;
    }
    for (int[] automorphism : automorphisms) {
      if (!fixes(automorphism, prefix)) {
        continue;
      }
      for (int u = 0; u < n; u++) {
        int a = find(parent, u);
        int b = find(parent, automorphism[u]);
        if (a != b) {
          parent[Math.max(a, b)] = Math.min(a, b);
        }
      }
    }
    int root = find(parent, unit);
    for (int u : explored) {
      if (find(parent, u) == root) {
        return true;
      }
    }
    return false;
  }

  private static boolean fixes(int[] automorphism, List<Integer> units) {
    for (int u : units) {
      if (automorphism[u] != u) {
        return false;
      }
    }
    return true;
  }

  private static int find(int[] parent, int i) {
    while (parent[i] != i) {
      parent[i] = parent[parent[i]];
      i = parent[i];
    }
    return i;
  }

  private void leaf(int[] labels) {
    leaves++;
    String certificate = certificate(labels);
    if (firstLabels == null) {
      firstLabels = labels;
      firstCertificate = certificate;
      bestLabels = labels;
      bestCertificate = certificate;
      return;
    }
    if (certificate.equals(firstCertificate)) {
      automorphisms.add(symmetry(firstLabels, labels));
      return;
    }
    int comparison = certificate.compareTo(bestCertificate);
    if (comparison == 0) {
      automorphisms.add(symmetry(bestLabels, labels));
    } else if (comparison < 0) {
      bestLabels = labels;
      bestCertificate = certificate;
    }
  }

  /**
   * The unit mapping that carries one numbering onto another.
   */
  private int[] symmetry(int[] from, int[] to) {
    int[] byLabel = new int[n];
    for (int u = 0; u < n; u++) {
      byLabel[to[u]] = u;
    }
    int[] mapping = new int[n];
    for (int u = 0; u < n; u++) {
      mapping[u] = byLabel[from[u]];
    }
    return mapping;
  }

  private String certificate(int[] labels) {
    int[] byLabel = new int[n];
    for (int u = 0; u < n; u++) {
      byLabel[labels[u]] = u;
    }
    StringBuilder certificate = new StringBuilder();
    Map<String, Integer> families = new HashMap<>();
    for (int i = 0; i < n; i++) {
      UnitNode unit = flowsheet.getUnit(byLabel[i]);
      certificate.append(unit.getType().length()).append(':').append(unit.getType());
      if (unit.isSubNode()) {
        certificate.append('-').append(families.computeIfAbsent(unit.getFamilyName(), k -> families.size() + 1));
      }
      certificate.append(';');
    }

    List<StreamEdge> streams = new ArrayList<>(flowsheet.getStreams());
    streams.sort(Comparator.<StreamEdge>comparingInt(e -> labels[e.getSource()])
        .thenComparingInt(e -> labels[e.getTarget()])
        .thenComparing(StreamEdge::getKind));
    Map<String, Map<String, String>> streamLabels = new HashMap<>();
    for (StreamEdge e : streams) {
      String tags = PlanRenderer.tagText(flowsheet, e, streamLabels);
      certificate.append(labels[e.getSource()]).append(e.getKind().name().charAt(0)).append(labels[e.getTarget()])
          .append('{').append(tags.length()).append(':').append(tags).append('}');
    }
    return certificate.toString();
  }

  private static <T extends Comparable<T>> int[] compress(List<T> keys) {
    List<Integer> order = new ArrayList<>(keys.size());
    for (int i = 0; i < keys.size(); i++) {
      order.add(i);
    }
    order.sort(Comparator.comparing(keys::get));

    int[] colours = new int[keys.size()];
    int colour = -1;
    T previous = null;
    for (int i : order) {
      if (previous == null || previous.compareTo(keys.get(i)) != 0) {
        colour++;
        previous = keys.get(i);
      }
      colours[i] = colour;
    }
    return colours;
  }

  private static int countClasses(int[] colours) {
    int max = -1;
    for (int c : colours) {
      max = Math.max(max, c);
    }
    return max + 1;
  }

  private static String pad(int colour) {
    return String.format("%08d", colour);
  }
}
