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

package com.twentyn.sfiles.tools;

import com.twentyn.sfiles.MalformedSyntaxException;
import com.twentyn.sfiles.Sfiles;
import com.twentyn.sfiles.graph.Flowsheet;
import com.twentyn.sfiles.graph.FlowsheetJson;
import com.twentyn.sfiles.report.FlowsheetReport;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.mockito.Mockito;

import java.io.File;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class SfilesToolTest {

  @Rule
  public TemporaryFolder temporaryFolder = new TemporaryFolder();

  private static CommandLine parse(String... args) throws Exception {
    return new DefaultParser().parse(SfilesTool.buildOptions(), args);
  }

  @Test
  public void testCanonicalizesInput() throws Exception {
    String result = new SfilesTool(parse("--input", "(raw)[(hex)(sep)(prod)](r)")).run();
    assertEquals("Input is written canonically", "(raw)[(r)](hex)(sep)(prod)", result);
  }

  @Test
  public void testEncoderFlags() throws Exception {
    String text = "(raw)[(hex)(sep)(prod)](r)";
    assertEquals("Non-canonical keeps the input order", text,
        new SfilesTool(parse("-i", text, "--non-canonical")).run());
    assertEquals("V1 drops tags", "(raw)(hex)(prod)",
        new SfilesTool(parse("-i", "(raw)(hex){hot_in}(prod)", "--version", "v1")).run());
  }

  @Test
  public void testMergeAndWriteGraph() throws Exception {
    File graphFile = new File(temporaryFolder.getRoot(), "out.json");
    String prefix = new File(temporaryFolder.getRoot(), "report").getPath();

    String result = new SfilesTool(parse("-i", "(raw)(hex-1/1)(prod)n|(raw)(hex-1/2)(prod)", "--merge-hi",
        "--output-graph", graphFile.getPath(), "--report", prefix)).run();

    assertEquals("Sub-nodes are merged before writing",
        "(raw)<&|(raw)&|{1_in}(hex){2_in}[(prod){2_out}](prod){1_out}", result);
    Flowsheet written = FlowsheetJson.readFlowsheet(graphFile);
    assertEquals("Merged flowsheet is saved", 5, written.size());
    assertTrue("Report is written", new File(prefix + FlowsheetReport.UNITS_SUFFIX).exists());
  }

  @Test
  public void testReadsGraphFile() throws Exception {
    File graphFile = temporaryFolder.newFile("in.json");
    FlowsheetJson.writeFlowsheet(Sfiles.parse("(raw)(r)<1(sep)1(prod)"), graphFile);

    assertEquals("Graph JSON is encoded", "(raw)(r)<1(sep)1(prod)",
        new SfilesTool(parse("--graph", graphFile.getPath())).run());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRequiresExactlyOneInput() throws Exception {
    CommandLine cl = Mockito.mock(CommandLine.class);
    Mockito.when(cl.hasOption(SfilesTool.OPTION_INPUT)).thenReturn(true);
    Mockito.when(cl.hasOption(SfilesTool.OPTION_GRAPH)).thenReturn(true);
    new SfilesTool(cl).run();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRejectsMergeWithSplit() throws Exception {
    new SfilesTool(parse("-i", "(raw)(prod)", "--merge-hi", "--split-hi")).run();
  }

  @Test(expected = MalformedSyntaxException.class)
  public void testReportsSyntaxErrors() throws Exception {
    CommandLine cl = Mockito.mock(CommandLine.class);
    Mockito.when(cl.hasOption(SfilesTool.OPTION_INPUT)).thenReturn(true);
    Mockito.when(cl.getOptionValue(SfilesTool.OPTION_INPUT)).thenReturn("(raw) (prod)");
    new SfilesTool(cl).run();
  }
}
