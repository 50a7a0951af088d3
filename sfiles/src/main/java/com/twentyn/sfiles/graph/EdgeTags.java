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

import org.apache.commons.collections4.CollectionUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The annotations carried by one stream.  Each kind of annotation is kept as its own ordered sequence so that the
 * order in which entries were written survives a round trip.  Entries that are well formed but not understood are
 * kept verbatim in {@link #getOther()}.
 */
public class EdgeTags {
  public static final EdgeTags EMPTY = new EdgeTags(
      Collections.emptyList(), Collections.emptyList(), Collections.emptyList(), Collections.emptyList());

  /* Every tag entry has the shape <kind>_<qualifier>; the qualifier may itself contain underscores. */
  public static final Pattern ENTRY_PATTERN = Pattern.compile("^[A-Za-z0-9]+(_[A-Za-z0-9]+)+$");

  private static final Pattern HEAT_INTEGRATION_PATTERN = Pattern.compile("^(hot|cold|[1-9][0-9]*)_(in|out)$");
  private static final Pattern COLUMN_PATTERN = Pattern.compile("^(top|bottom|side)_(in|out)$");
  private static final Pattern SIGNAL_PATTERN = Pattern.compile("^sig_([A-Za-z0-9]+(?:_[A-Za-z0-9]+)*)$");

  private final List<HeatIntegrationTag> heatIntegration;
  private final List<ColumnTag> column;
  private final List<SignalTag> signal;
  private final List<String> other;

  private EdgeTags(List<HeatIntegrationTag> heatIntegration, List<ColumnTag> column,
                   List<SignalTag> signal, List<String> other) {
    this.heatIntegration = Collections.unmodifiableList(heatIntegration);
    this.column = Collections.unmodifiableList(column);
    this.signal = Collections.unmodifiableList(signal);
    this.other = Collections.unmodifiableList(other);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Parses a list of textual tag entries, in order.
   *
   * @param entries The entries, e.g. "hot_in" or "top_out".
   * @return The structured tags.
   * @throws IllegalArgumentException if an entry does not have the <kind>_<qualifier> shape.
   */
  public static EdgeTags fromEntries(List<String> entries) {
    Builder builder = builder();
    entries.forEach(builder::addEntry);
    return builder.build();
  }

  public static boolean isWellFormedEntry(String entry) {
    return entry != null && ENTRY_PATTERN.matcher(entry).matches();
  }

  public List<HeatIntegrationTag> getHeatIntegration() {
    return heatIntegration;
  }

  public List<ColumnTag> getColumn() {
    return column;
  }

  public List<SignalTag> getSignal() {
    return signal;
  }

  public List<String> getOther() {
    return other;
  }

  public boolean isEmpty() {
    return size() == 0;
  }

  public int size() {
    return heatIntegration.size() + column.size() + signal.size() + other.size();
  }

  public boolean hasNumberedHeatIntegration() {
    return heatIntegration.stream().anyMatch(HeatIntegrationTag::isNumbered);
  }

  /**
   * All entries in rendering order: heat integration, column, signal, then the opaque ones.
   */
  public List<String> toEntries() {
    List<String> entries = new ArrayList<>(size());
    heatIntegration.forEach(t -> entries.add(t.toText()));
    column.forEach(t -> entries.add(t.toText()));
    signal.forEach(t -> entries.add(t.toText()));
    entries.addAll(other);
    return entries;
  }

  public EdgeTags withHeatIntegration(List<HeatIntegrationTag> replacement) {
    return new EdgeTags(new ArrayList<>(replacement), new ArrayList<>(column),
        new ArrayList<>(signal), new ArrayList<>(other));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    EdgeTags that = (EdgeTags) o;
    return heatIntegration.equals(that.heatIntegration) && column.equals(that.column) &&
        signal.equals(that.signal) && other.equals(that.other);
  }

  @Override
  public int hashCode() {
    return Objects.hash(heatIntegration, column, signal, other);
  }

  @Override
  public String toString() {
    return "{" + String.join(";", toEntries()) + "}";
  }

  public static class Builder {
    private final List<HeatIntegrationTag> heatIntegration = new ArrayList<>();
    private final List<ColumnTag> column = new ArrayList<>();
    private final List<SignalTag> signal = new ArrayList<>();
    private final List<String> other = new ArrayList<>();

    private Builder() {
    }

    public Builder addEntry(String entry) {
      if (!isWellFormedEntry(entry)) {
        throw new IllegalArgumentException(String.format("Tag entry '%s' is not of the form <kind>_<qualifier>", entry));
      }

      Matcher m = HEAT_INTEGRATION_PATTERN.matcher(entry);
      if (m.matches()) {
        heatIntegration.add(new HeatIntegrationTag(m.group(1), Port.fromText(m.group(2))));
        return this;
      }
      m = COLUMN_PATTERN.matcher(entry);
      if (m.matches()) {
        column.add(new ColumnTag(ColumnTag.Position.fromText(m.group(1)), Port.fromText(m.group(2))));
        return this;
      }
      m = SIGNAL_PATTERN.matcher(entry);
      if (m.matches()) {
        signal.add(new SignalTag(m.group(1)));
        return this;
      }
      other.add(entry);
      return this;
    }

    public Builder addAll(EdgeTags tags) {
      heatIntegration.addAll(tags.heatIntegration);
      column.addAll(tags.column);
      signal.addAll(tags.signal);
      other.addAll(tags.other);
      return this;
    }

    public Builder addHeatIntegration(HeatIntegrationTag tag) {
      heatIntegration.add(tag);
      return this;
    }

    public Builder addColumn(ColumnTag tag) {
      column.add(tag);
      return this;
    }

    public Builder addSignal(SignalTag tag) {
      signal.add(tag);
      return this;
    }

    public boolean isEmpty() {
      return CollectionUtils.isEmpty(heatIntegration) && CollectionUtils.isEmpty(column) &&
          CollectionUtils.isEmpty(signal) && CollectionUtils.isEmpty(other);
    }

    public EdgeTags build() {
      if (isEmpty()) {
        return EMPTY;
      }
      return new EdgeTags(new ArrayList<>(heatIntegration), new ArrayList<>(column),
          new ArrayList<>(signal), new ArrayList<>(other));
    }
  }
}
