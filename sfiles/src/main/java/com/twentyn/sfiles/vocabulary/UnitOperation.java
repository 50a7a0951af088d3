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

package com.twentyn.sfiles.vocabulary;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * The unit operations commonly found in process flow diagrams, with their SFILES codes.
 */
public enum UnitOperation {
  FEED("Raw material feed", "raw"),
  PRODUCT("Product", "prod"),
  REACTOR("Reactor", "r"),
  HEAT_EXCHANGER("Heat exchanger", "hex"),
  SEPARATOR("Separator", "sep"),
  DISTILLATION_COLUMN("Distillation column", "dist"),
  ABSORPTION_COLUMN("Absorption column", "abs"),
  PUMP("Pump", "pp"),
  COMPRESSOR("Compressor", "comp"),
  VALVE("Valve", "v"),
  MIXER("Mixer", "mix"),
  SPLITTER("Splitter", "splt"),
  HEATER("Heater", "heater"),
  COOLER("Cooler", "cooler"),
  TANK("Tank", "tank"),
  FILTER("Filter", "filt"),
  CONTROLLER("Controller", "C");

  private static final Map<String, UnitOperation> BY_CODE = new HashMap<>();
  private static final Map<String, UnitOperation> BY_NAME = new HashMap<>();

  static {
    for (UnitOperation op : values()) {
      BY_CODE.put(op.code, op);
      BY_NAME.put(op.displayName.toLowerCase(), op);
    }
  }

  /**
   * The default vocabulary.  Names are matched ignoring case, codes exactly.
   */
  public static final UnitVocabulary VOCABULARY = new UnitVocabulary() {
    @Override
    public String toCode(String name) {
      return fromName(name).getCode();
    }

    @Override
    public String toName(String code) {
      return fromCode(code).getDisplayName();
    }

    @Override
    public boolean hasCode(String code) {
      return BY_CODE.containsKey(code);
    }

    @Override
    public Set<String> getCodes() {
      Set<String> codes = new LinkedHashSet<>();
      for (UnitOperation op : values()) {
        codes.add(op.code);
      }
      return Collections.unmodifiableSet(codes);
    }
  };

  private final String displayName;
  private final String code;

  UnitOperation(String displayName, String code) {
    this.displayName = displayName;
    this.code = code;
  }

  public String getDisplayName() {
    return displayName;
  }

  public String getCode() {
    return code;
  }

  public static UnitOperation fromCode(String code) {
    UnitOperation op = BY_CODE.get(code);
    if (op == null) {
      throw new IllegalArgumentException(String.format("Unknown unit operation code '%s'", code));
    }
    return op;
  }

  public static UnitOperation fromName(String name) {
    UnitOperation op = name == null ? null : BY_NAME.get(name.toLowerCase());
    if (op == null) {
      throw new IllegalArgumentException(String.format("Unknown unit operation '%s'", name));
    }
    return op;
  }
}
