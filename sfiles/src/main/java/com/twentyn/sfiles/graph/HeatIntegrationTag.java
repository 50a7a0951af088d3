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

import org.apache.commons.lang3.StringUtils;

import java.util.Objects;

/**
 * Marks a stream as entering or leaving one stream pair of a heat exchanger.  The stream id is either one of the
 * named sides "hot" and "cold" or a positive stream pair number used by multi-stream exchangers.
 */
public class HeatIntegrationTag {
  public static final String HOT = "hot";
  public static final String COLD = "cold";

  private final String stream;
  private final Port port;

  public HeatIntegrationTag(String stream, Port port) {
    if (!isValidStream(stream) || port == null) {
      throw new IllegalArgumentException(
          String.format("Invalid heat integration tag: stream '%s', port %s", stream, port));
    }
    this.stream = stream;
    this.port = port;
  }

  public static boolean isValidStream(String stream) {
    if (stream == null) {
      return false;
    }
    return HOT.equals(stream) || COLD.equals(stream) ||
        (StringUtils.isNumeric(stream) && !stream.startsWith("0"));
  }

  public String getStream() {
    return stream;
  }

  public Port getPort() {
    return port;
  }

  /**
   * Numbered streams are labels local to one exchanger and may be relabelled freely.
   */
  public boolean isNumbered() {
    return StringUtils.isNumeric(stream);
  }

  public HeatIntegrationTag withStream(String newStream) {
    return new HeatIntegrationTag(newStream, port);
  }

  public String toText() {
    return stream + "_" + port.getText();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    HeatIntegrationTag that = (HeatIntegrationTag) o;
    return stream.equals(that.stream) && port == that.port;
  }

  @Override
  public int hashCode() {
    return Objects.hash(stream, port);
  }

  @Override
  public String toString() {
    return toText();
  }
}
