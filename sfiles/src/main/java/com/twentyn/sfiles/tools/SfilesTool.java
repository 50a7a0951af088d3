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

import com.twentyn.sfiles.EncoderOptions;
import com.twentyn.sfiles.Sfiles;
import com.twentyn.sfiles.SfilesException;
import com.twentyn.sfiles.SfilesVersion;
import com.twentyn.sfiles.graph.Flowsheet;
import com.twentyn.sfiles.graph.FlowsheetJson;
import com.twentyn.sfiles.heatintegration.HeatIntegrationNormalizer;
import com.twentyn.sfiles.report.FlowsheetReport;
import com.twentyn.sfiles.vocabulary.UnitOperation;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.lang3.Validate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a flowsheet from SFILES text or graph JSON, optionally merges or splits its heat exchangers, and prints its
 * SFILES encoding.  The flowsheet can also be saved as graph JSON or tabulated.
 */
public class SfilesTool {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SfilesTool.class);

  public static final String OPTION_INPUT = "i";
  public static final String OPTION_GRAPH = "g";
  public static final String OPTION_VERSION = "v";
  public static final String OPTION_NON_CANONICAL = "n";
  public static final String OPTION_REMOVE_NUMBERING = "r";
  public static final String OPTION_MERGE_HI = "m";
  public static final String OPTION_SPLIT_HI = "s";
  public static final String OPTION_OUTPUT_GRAPH = "o";
  public static final String OPTION_REPORT = "t";

  public static final String HELP_MESSAGE =
      "This class converts process flowsheets between SFILES text and graph JSON, writing canonical SFILES by default";

  public static final List<Option.Builder> OPTION_BUILDERS = new ArrayList<Option.Builder>() {{
    add(Option.builder(OPTION_INPUT)
        .argName("sfiles")
        .desc("An SFILES string to read")
        .hasArg()
        .longOpt("input")
    );
    add(Option.builder(OPTION_GRAPH)
        .argName("json file")
        .desc("A graph JSON file to read instead of an SFILES string")
        .hasArg()
        .longOpt("graph")
    );
    add(Option.builder(OPTION_VERSION)
        .argName("version")
        .desc("The SFILES version to write, v1 or v2 (default v2); input of either version is accepted")
        .hasArg()
        .longOpt("version")
    );
    add(Option.builder(OPTION_NON_CANONICAL)
        .desc("Write units in the order they were read instead of the canonical order")
        .longOpt("non-canonical")
    );
    add(Option.builder(OPTION_REMOVE_NUMBERING)
        .desc("Write every unit by its type alone")
        .longOpt("remove-numbering")
    );
    add(Option.builder(OPTION_MERGE_HI)
        .desc("Merge heat exchanger sub-nodes into multi-stream exchangers before writing")
        .longOpt("merge-hi")
    );
    add(Option.builder(OPTION_SPLIT_HI)
        .desc("Split multi-stream heat exchangers into one sub-node per stream before writing")
        .longOpt("split-hi")
    );
    add(Option.builder(OPTION_OUTPUT_GRAPH)
        .argName("json file")
        .desc("Also write the flowsheet as graph JSON to this file")
        .hasArg()
        .longOpt("output-graph")
    );
    add(Option.builder(OPTION_REPORT)
        .argName("prefix")
        .desc("Also write unit and stream tables to <prefix>.units.tsv and <prefix>.streams.tsv")
        .hasArg()
        .longOpt("report")
    );
    add(Option.builder("h")
        .argName("help")
        .desc("Prints this help message")
        .longOpt("help")
    );
  }};

  public static final HelpFormatter HELP_FORMATTER = new HelpFormatter();

  static {
    HELP_FORMATTER.setWidth(100);
  }

  private final CommandLine cl;

  public SfilesTool(CommandLine cl) {
    this.cl = cl;
  }

  public static Options buildOptions() {
    Options opts = new Options();
    for (Option.Builder b : OPTION_BUILDERS) {
      opts.addOption(b.build());
    }
    return opts;
  }

  /**
   * Carries out everything the command line asks for.
   *
   * @return The SFILES encoding of the flowsheet.
   * @throws IllegalArgumentException if the options contradict each other.
   */
  public String run() throws SfilesException, IOException {
    Validate.isTrue(cl.hasOption(OPTION_INPUT) ^ cl.hasOption(OPTION_GRAPH),
        "Exactly one of --input and --graph must be given");
    Validate.isTrue(!(cl.hasOption(OPTION_MERGE_HI) && cl.hasOption(OPTION_SPLIT_HI)),
        "--merge-hi and --split-hi cannot be combined");
    SfilesVersion version = cl.hasOption(OPTION_VERSION) ?
        SfilesVersion.fromText(cl.getOptionValue(OPTION_VERSION)) : SfilesVersion.V2;

    Flowsheet flowsheet;
    if (cl.hasOption(OPTION_INPUT)) {
      flowsheet = Sfiles.parse(cl.getOptionValue(OPTION_INPUT));
    } else {
      File graphFile = new File(cl.getOptionValue(OPTION_GRAPH));
      verifyInputFile(graphFile);
      flowsheet = FlowsheetJson.readFlowsheet(graphFile);
    }
    LOGGER.info("Read flowsheet with %d units and %d streams", flowsheet.size(), flowsheet.getStreams().size());

    if (cl.hasOption(OPTION_MERGE_HI)) {
      flowsheet = HeatIntegrationNormalizer.merge(flowsheet);
      LOGGER.info("Merged heat exchangers, %d units remain", flowsheet.size());
    } else if (cl.hasOption(OPTION_SPLIT_HI)) {
      flowsheet = HeatIntegrationNormalizer.split(flowsheet);
      LOGGER.info("Split heat exchangers into %d units", flowsheet.size());
    }

    if (cl.hasOption(OPTION_OUTPUT_GRAPH)) {
      File outputFile = new File(cl.getOptionValue(OPTION_OUTPUT_GRAPH));
      FlowsheetJson.writeFlowsheet(flowsheet, outputFile);
      LOGGER.info("Wrote graph JSON to %s", outputFile.getPath());
    }
    if (cl.hasOption(OPTION_REPORT)) {
      new FlowsheetReport(flowsheet, UnitOperation.VOCABULARY).write(cl.getOptionValue(OPTION_REPORT));
    }

    EncoderOptions options = EncoderOptions.builder()
        .setVersion(version)
        .setCanonical(!cl.hasOption(OPTION_NON_CANONICAL))
        .setRemoveNumbering(cl.hasOption(OPTION_REMOVE_NUMBERING))
        .build();
    return Sfiles.encode(flowsheet, options);
  }

  private static void verifyInputFile(File file) throws IOException {
    if (!file.exists()) {
      throw new IOException(String.format("Input file %s does not exist", file.getPath()));
    }
    if (!file.isFile()) {
      throw new IOException(String.format("Input file %s is not a regular file", file.getPath()));
    }
  }

  public static void main(String[] args) throws Exception {
    Options opts = buildOptions();

    CommandLine cl = null;
    try {
      CommandLineParser parser = new DefaultParser();
      cl = parser.parse(opts, args);
    } catch (ParseException e) {
      LOGGER.error("Argument parsing failed: %s", e.getMessage());
      HELP_FORMATTER.printHelp(SfilesTool.class.getCanonicalName(), HELP_MESSAGE, opts, null, true);
      System.exit(1);
    }

    if (cl.hasOption("help")) {
      HELP_FORMATTER.printHelp(SfilesTool.class.getCanonicalName(), HELP_MESSAGE, opts, null, true);
      return;
    }

    try {
      System.out.println(new SfilesTool(cl).run());
    } catch (IllegalArgumentException e) {
      LOGGER.error("Invalid arguments: %s", e.getMessage());
      HELP_FORMATTER.printHelp(SfilesTool.class.getCanonicalName(), HELP_MESSAGE, opts, null, true);
      System.exit(1);
    } catch (SfilesException e) {
      LOGGER.error("Conversion failed: %s", e.getMessage());
      System.exit(2);
    }
  }
}
