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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Serialized form of a flowsheet, for handing graphs to and from tools that do not speak SFILES.  Streams refer to
 * their endpoints by unit name, so the files stay readable and independent of internal ids.
 */
public class FlowsheetJson {

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
      .enable(SerializationFeature.INDENT_OUTPUT);

  @JsonProperty("units")
  private List<UnitRecord> units;

  @JsonProperty("streams")
  private List<StreamRecord> streams;

  @JsonCreator
  public FlowsheetJson(@JsonProperty("units") List<UnitRecord> units,
                       @JsonProperty("streams") List<StreamRecord> streams) {
    this.units = units == null ? new ArrayList<>() : units;
    this.streams = streams == null ? new ArrayList<>() : streams;
  }

  public List<UnitRecord> getUnits() {
    return Collections.unmodifiableList(units);
  }

  public List<StreamRecord> getStreams() {
    return Collections.unmodifiableList(streams);
  }

  public static FlowsheetJson fromFlowsheet(Flowsheet flowsheet) {
    List<UnitRecord> units = new ArrayList<>(flowsheet.size());
    for (UnitNode u : flowsheet.getUnits()) {
      units.add(new UnitRecord(u.getType(), u.getIndex(), u.getSubIndex()));
    }
    List<StreamRecord> streams = new ArrayList<>();
    for (StreamEdge e : flowsheet.getStreams()) {
      streams.add(new StreamRecord(flowsheet.getUnit(e.getSource()).getName(),
          flowsheet.getUnit(e.getTarget()).getName(), e.getKind(), e.getTags().toEntries()));
    }
    return new FlowsheetJson(units, streams);
  }

  /**
   * Rebuilds the flowsheet this record describes.
   *
   * @return A new flowsheet.
   * @throws IllegalArgumentException if a stream names an unknown unit or a tag entry is malformed.
   */
  public Flowsheet toFlowsheet() {
    Flowsheet flowsheet = new Flowsheet();
    for (UnitRecord u : units) {
      flowsheet.addUnit(u.getType(), u.getIndex(), u.getSubIndex());
    }
    for (StreamRecord s : streams) {
      UnitNode source = flowsheet.getUnitByName(s.getSource());
      UnitNode target = flowsheet.getUnitByName(s.getTarget());
      EdgeKind kind = s.getKind() == null ? EdgeKind.MATERIAL : s.getKind();
      flowsheet.addStream(source.getId(), target.getId(), kind, EdgeTags.fromEntries(s.getTags()));
    }
    return flowsheet;
  }

  public static Flowsheet readFlowsheet(File inputFile) throws IOException {
    return OBJECT_MAPPER.readValue(inputFile, FlowsheetJson.class).toFlowsheet();
  }

  public static void writeFlowsheet(Flowsheet flowsheet, File outputFile) throws IOException {
    try (BufferedWriter writer = new BufferedWriter(
        new OutputStreamWriter(new FileOutputStream(outputFile), StandardCharsets.UTF_8))) {
      OBJECT_MAPPER.writeValue(writer, fromFlowsheet(flowsheet));
    }
  }

  public static String toJsonString(Flowsheet flowsheet) throws IOException {
    return OBJECT_MAPPER.writeValueAsString(fromFlowsheet(flowsheet));
  }

  public static Flowsheet fromJsonString(String json) throws IOException {
    return OBJECT_MAPPER.readValue(json, FlowsheetJson.class).toFlowsheet();
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static class UnitRecord {
    @JsonProperty("type")
    private String type;

    @JsonProperty("index")
    private int index;

    @JsonProperty("sub_index")
    private Integer subIndex;

    @JsonCreator
    public UnitRecord(@JsonProperty("type") String type,
                      @JsonProperty("index") int index,
                      @JsonProperty("sub_index") Integer subIndex) {
      this.type = type;
      this.index = index;
      this.subIndex = subIndex;
    }

    public String getType() {
      return type;
    }

    public int getIndex() {
      return index;
    }

    public Integer getSubIndex() {
      return subIndex;
    }
  }

  public static class StreamRecord {
    @JsonProperty("source")
    private String source;

    @JsonProperty("target")
    private String target;

    @JsonProperty("kind")
    private EdgeKind kind;

    @JsonProperty("tags")
    private List<String> tags;

    @JsonCreator
    public StreamRecord(@JsonProperty("source") String source,
                        @JsonProperty("target") String target,
                        @JsonProperty("kind") EdgeKind kind,
                        @JsonProperty("tags") List<String> tags) {
      this.source = source;
      this.target = target;
      this.kind = kind;
      this.tags = tags == null ? new ArrayList<>() : tags;
    }

    public String getSource() {
      return source;
    }

    public String getTarget() {
      return target;
    }

    public EdgeKind getKind() {
      return kind;
    }

    public List<String> getTags() {
      return tags;
    }
  }
}
