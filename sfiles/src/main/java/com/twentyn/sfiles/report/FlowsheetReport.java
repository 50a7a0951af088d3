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

package com.twentyn.sfiles.report;

import com.twentyn.sfiles.graph.EdgeKind;
import com.twentyn.sfiles.graph.Flowsheet;
import com.twentyn.sfiles.graph.StreamEdge;
import com.twentyn.sfiles.graph.UnitNode;
import com.twentyn.sfiles.syntax.Token;
import com.twentyn.sfiles.vocabulary.UnitVocabulary;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Tabulates the units and streams of a flowsheet, one row each, for inspection in a spreadsheet.
 */
public class FlowsheetReport {
  private static final Logger LOGGER = LogManager.getFormatterLogger(FlowsheetReport.class);

  public static final String UNITS_SUFFIX = ".units.tsv";
  public static final String STREAMS_SUFFIX = ".streams.tsv";

  private static final CSVFormat TSV_FORMAT = CSVFormat.newFormat('\t')
      .withRecordSeparator('\n').withQuote('"').withIgnoreEmptyLines(true);

  public enum UnitField {
    NAME("name"),
    TYPE("type"),
    OPERATION("operation"),
    INDEX("index"),
    SUB_INDEX("sub_index"),
    IN_STREAMS("in_streams"),
    OUT_STREAMS("out_streams"),
    SIGNALS("signals"),
    ;

    private final String header;

    UnitField(String header) {
      this.header = header;
    }

    @Override
    public String toString() {
      return header;
    }
  }

  public enum StreamField {
    SOURCE("source"),
    TARGET("target"),
    KIND("kind"),
    TAGS("tags"),
    ;

    private final String header;

    StreamField(String header) {
      this.header = header;
    }

    @Override
    public String toString() {
      return header;
    }
  }

  private final Flowsheet flowsheet;
  // May be null, in which case the operation column stays empty.
  private final UnitVocabulary vocabulary;

  public FlowsheetReport(Flowsheet flowsheet, UnitVocabulary vocabulary) {
    this.flowsheet = flowsheet;
    this.vocabulary = vocabulary;
  }

  public List<Map<UnitField, String>> unitRows() {
    List<Map<UnitField, String>> rows = new ArrayList<>(flowsheet.size());
    for (UnitNode u : flowsheet.getUnits()) {
      Map<UnitField, String> row = new EnumMap<>(UnitField.class);
      row.put(UnitField.NAME, u.getName());
      row.put(UnitField.TYPE, u.getType());
      row.put(UnitField.OPERATION,
          vocabulary != null && vocabulary.hasCode(u.getType()) ? vocabulary.toName(u.getType()) : "");
      row.put(UnitField.INDEX, Integer.toString(u.getIndex()));
      row.put(UnitField.SUB_INDEX, u.isSubNode() ? u.getSubIndex().toString() : "");
      row.put(UnitField.IN_STREAMS, Integer.toString(flowsheet.getInStreams(u.getId(), EdgeKind.MATERIAL).size()));
      row.put(UnitField.OUT_STREAMS, Integer.toString(flowsheet.getOutStreams(u.getId(), EdgeKind.MATERIAL).size()));
      row.put(UnitField.SIGNALS, Integer.toString(flowsheet.getInStreams(u.getId(), EdgeKind.SIGNAL).size() +
          flowsheet.getOutStreams(u.getId(), EdgeKind.SIGNAL).size()));
      rows.add(row);
    }
    return rows;
  }

  public List<Map<StreamField, String>> streamRows() {
    List<Map<StreamField, String>> rows = new ArrayList<>();
    for (StreamEdge e : flowsheet.getStreams()) {
      Map<StreamField, String> row = new EnumMap<>(StreamField.class);
      row.put(StreamField.SOURCE, flowsheet.getUnit(e.getSource()).getName());
      row.put(StreamField.TARGET, flowsheet.getUnit(e.getTarget()).getName());
      row.put(StreamField.KIND, e.getKind().name().toLowerCase());
      List<String> tags = e.getTags().toEntries();
      row.put(StreamField.TAGS, CollectionUtils.isEmpty(tags) ? "" : String.join(Token.TAG_ENTRY_SEPARATOR, tags));
      rows.add(row);
    }
    return rows;
  }

  /**
   * Writes the units table; the writer is closed afterwards.
   */
  public void writeUnits(Writer writer) throws IOException {
    writeTable(writer, UnitField.values(), unitRows());
  }

  public void writeStreams(Writer writer) throws IOException {
    writeTable(writer, StreamField.values(), streamRows());
  }

  /**
   * Writes both tables next to each other, as prefix.units.tsv and prefix.streams.tsv, in UTF-8.
   */
  public void write(String prefix) throws IOException {
    File unitsFile = new File(prefix + UNITS_SUFFIX);
    File streamsFile = new File(prefix + STREAMS_SUFFIX);
    writeUnits(new OutputStreamWriter(new FileOutputStream(unitsFile), StandardCharsets.UTF_8));
    writeStreams(new OutputStreamWriter(new FileOutputStream(streamsFile), StandardCharsets.UTF_8));
    LOGGER.info("Wrote %d units to %s and %d streams to %s",
        flowsheet.size(), unitsFile.getPath(), flowsheet.getStreams().size(), streamsFile.getPath());
  }

  /**
   * One header line naming the columns, then one record per row in column order.  Missing cells are left empty.
   */
  private static <F extends Enum<F>> void writeTable(Writer writer, F[] columns, List<Map<F, String>> rows)
      throws IOException {
    String[] header = new String[columns.length];
    for (int i = 0; i < columns.length; i++) {
      header[i] = columns[i].toString();
    }
    try (CSVPrinter printer = new CSVPrinter(writer, TSV_FORMAT.withHeader(header))) {
      for (Map<F, String> row : rows) {
        List<String> values = new ArrayList<>(columns.length);
        for (F column : columns) {
          values.add(row.get(column));
        }
        printer.printRecord(values);
      }
    }
  }
}
