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

package com.twentyn.sfiles;

import java.util.Objects;

/**
 * How a flowsheet should be written.  The defaults produce the canonical V2 string with sub-node numbering.
 */
public class EncoderOptions {
  public static final EncoderOptions DEFAULT = builder().build();

  private final SfilesVersion version;
  private final boolean canonical;
  private final boolean removeNumbering;

  private EncoderOptions(SfilesVersion version, boolean canonical, boolean removeNumbering) {
    this.version = version;
    this.canonical = canonical;
    this.removeNumbering = removeNumbering;
  }

  public static Builder builder() {
    return new Builder();
  }

  public SfilesVersion getVersion() {
    return version;
  }

  /**
   * @return False to trade the uniqueness guarantee for a plain insertion order traversal, for debugging.
   */
  public boolean isCanonical() {
    return canonical;
  }

  /**
   * @return True to write every unit by its type alone, for comparing flowsheet templates.
   */
  public boolean isRemoveNumbering() {
    return removeNumbering;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    EncoderOptions that = (EncoderOptions) o;
    return canonical == that.canonical && removeNumbering == that.removeNumbering && version == that.version;
  }

  @Override
  public int hashCode() {
    return Objects.hash(version, canonical, removeNumbering);
  }

  @Override
  public String toString() {
    return String.format("EncoderOptions[version=%s, canonical=%s, removeNumbering=%s]",
        version, canonical, removeNumbering);
  }

  public static class Builder {
    private SfilesVersion version = SfilesVersion.V2;
    private boolean canonical = true;
    private boolean removeNumbering = false;

    private Builder() {
    }

    public Builder setVersion(SfilesVersion version) {
      if (version == null) {
        throw new IllegalArgumentException("Version cannot be null");
      }
      this.version = version;
      return this;
    }

    public Builder setCanonical(boolean canonical) {
      this.canonical = canonical;
      return this;
    }

    public Builder setRemoveNumbering(boolean removeNumbering) {
      this.removeNumbering = removeNumbering;
      return this;
    }

    public EncoderOptions build() {
      return new EncoderOptions(version, canonical, removeNumbering);
    }
  }
}
