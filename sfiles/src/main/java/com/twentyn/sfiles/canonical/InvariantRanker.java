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

import com.twentyn.sfiles.graph.EdgeKind;
import com.twentyn.sfiles.graph.Flowsheet;
import com.twentyn.sfiles.graph.StreamEdge;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Computes an invariant rank for every unit by iterative refinement over material streams, in the spirit of the
 * Morgan algorithm for molecules.
 *
 * Units start out ranked by their (out-degree, in-degree) pair: more outgoing streams first, then fewer incoming
 * ones.  Every round re-ranks each unit by its own rank followed by the sorted ranks of its upstream and then its
 * downstream neighbours.  Since a unit's own rank leads its new label, classes only ever split and keep their
 * relative order.  Refinement stops once a round splits nothing.
 *
 * Only labels take part; ids, names and insertion order never do, so isomorphic flowsheets get the same ranks.  Units
 * sharing a rank are left for the encoder to tell apart.
 */
public class InvariantRanker {
  private static final Logger LOGGER = LogManager.getFormatterLogger(InvariantRanker.class);

  public InvariantRanker() {
  }

  /**
   * @param flowsheet The flowsheet to rank.
   * @return Dense ranks indexed by unit id, 0 being the first.
   */
  public int[] rank(Flowsheet flowsheet) {
    int n = flowsheet.size();
    List<List<Integer>> upstream = new ArrayList<>(n);
    List<List<Integer>> downstream = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      upstream.add(new ArrayList<>());
      downstream.add(new ArrayList<>());
    }
    for (StreamEdge e : flowsheet.getStreams(EdgeKind.MATERIAL)) {
      downstream.get(e.getSource()).add(e.getTarget());
      upstream.get(e.getTarget()).add(e.getSource());
    }

    int[][] labels = new int[n][];
    for (int i = 0; i < n; i++) {
      labels[i] = new int[]{-downstream.get(i).size(), upstream.get(i).size()};
    }
    int[] ranks = compress(labels);
    int classes = countClasses(ranks);

    for (int round = 0; round < n; round++) {
      for (int i = 0; i < n; i++) {
        labels[i] = neighbourhoodLabel(ranks, i, upstream.get(i), downstream.get(i));
      }
      int[] refined = compress(labels);
      int refinedClasses = countClasses(refined);
      ranks = refined;
      if (refinedClasses == classes) {
        LOGGER.debug("Ranking of %d units settled after %d rounds with %d classes", n, round + 1, classes);
        break;
      }
      classes = refinedClasses;
    }
    return ranks;
  }

  private static int[] neighbourhoodLabel(int[] ranks, int unit, List<Integer> up, List<Integer> down) {
    int[] label = new int[1 + up.size() + down.size()];
    label[0] = ranks[unit];
    int[] upRanks = up.stream().mapToInt(u -> ranks[u]).sorted().toArray();
    int[] downRanks = down.stream().mapToInt(u -> ranks[u]).sorted().toArray();
    System.arraycopy(upRanks, 0, label, 1, upRanks.length);
    System.arraycopy(downRanks, 0, label, 1 + upRanks.length, downRanks.length);
    return label;
  }

  /**
   * Replaces labels by their position among the distinct labels in lexicographic order.  Units with equal leading
   * rank share degrees, so their labels have equal length and the flattened comparison stays direction-aware.
   */
  private static int[] compress(int[][] labels) {
    int n = labels.length;
    List<Integer> order = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      order.add(i);
    }
    Collections.sort(order, (a, b) -> Arrays.compare(labels[a], labels[b]));

    int[] ranks = new int[n];
    int rank = -1;
    int[] previous = null;
    for (int i : order) {
      if (previous == null || !Arrays.equals(previous, labels[i])) {
        rank++;
        previous = labels[i];
      }
      ranks[i] = rank;
    }
    return ranks;
  }

  private static int countClasses(int[] ranks) {
    return Arrays.stream(ranks).max().orElse(-1) + 1;
  }
}
