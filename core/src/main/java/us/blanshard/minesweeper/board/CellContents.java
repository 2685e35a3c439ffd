/*
Copyright 2013 Luke Blanshard

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

     http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/
package us.blanshard.minesweeper.board;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.primitives.Ints;

import java.util.EnumSet;

import javax.annotation.concurrent.Immutable;

/**
 * What a player sees in one cell of a minesweeper board.  Has nested classes
 * for every kind of contents; the {@link Type} tells them apart.
 *
 * @author Luke Blanshard
 */
@Immutable
public abstract class CellContents {

  /**
   * All the kinds of cell contents, with the character that introduces each
   * in the text form.
   */
  public enum Type {
    UNCLICKED('#'),
    NUM('\0'),
    FLAG('F'),
    MINE('M'),
    HIT_MINE('!'),
    WRONG_FLAG('X');

    private static final EnumSet<Type> MINE_TYPES = EnumSet.of(FLAG, MINE, HIT_MINE, WRONG_FLAG);

    private final char symbol;

    Type(char symbol) {
      this.symbol = symbol;
    }

    /** Tells whether contents of this type show one or more mines or flags. */
    public boolean isMineType() {
      return MINE_TYPES.contains(this);
    }

    /** The leading character of this type's text form. */
    public char getSymbol() {
      return symbol;
    }
  }

  /** The single unclicked instance. */
  public static final Unclicked UNCLICKED = new Unclicked();

  public final Type type;

  protected CellContents(Type type) {
    this.type = type;
  }

  public static Num num(int number) {
    return number >= 0 && number < NUMS.length ? NUMS[number] : new Num(number);
  }

  public static Flag flag(int count) {
    return new Flag(count);
  }

  public static Mine mine(int count) {
    return new Mine(count);
  }

  public static HitMine hitMine(int count) {
    return new HitMine(count);
  }

  public static WrongFlag wrongFlag(int count) {
    return new WrongFlag(count);
  }

  /** Tells whether this cell has not been clicked or flagged. */
  public final boolean isUnclicked() {
    return type == Type.UNCLICKED;
  }

  /**
   * Parses the text form of cell contents: {@code #} for unclicked, a number
   * (or {@code .} for zero) for a revealed number, and {@code F}, {@code M},
   * {@code !} or {@code X} followed by a count for flags, mines, hit mines and
   * wrong flags.
   */
  public static CellContents fromString(String s) {
    checkArgument(!s.isEmpty(), "Empty cell contents");
    if (s.equals("#")) return UNCLICKED;
    if (s.equals(".")) return num(0);
    Integer number = Ints.tryParse(s);
    if (number != null) return num(number);
    Integer count = Ints.tryParse(s.substring(1));
    checkArgument(count != null, "Unrecognized cell contents: %s", s);
    switch (s.charAt(0)) {
      case 'F': return flag(count);
      case 'M': return mine(count);
      case '!': return hitMine(count);
      case 'X': return wrongFlag(count);
      default: throw new IllegalArgumentException("Unrecognized cell contents: " + s);
    }
  }

  /** Unclicked cell. */
  @Immutable
  public static final class Unclicked extends CellContents {
    private Unclicked() {
      super(Type.UNCLICKED);
    }

    @Override public String toString() {
      return "#";
    }
  }

  /** A revealed number: how many mines the neighboring cells hold. */
  @Immutable
  public static final class Num extends CellContents {
    public final int number;

    private Num(int number) {
      super(Type.NUM);
      checkArgument(number >= 0, "Cell number cannot be negative: %s", number);
      this.number = number;
    }

    @Override public boolean equals(Object o) {
      if (o == this) return true;
      if (!(o instanceof Num)) return false;
      return this.number == ((Num) o).number;
    }

    @Override public int hashCode() {
      return number;
    }

    @Override public String toString() {
      return Integer.toString(number);
    }
  }

  /**
   * Contents showing one or more mines or flags.  Several mines per cell are
   * allowed in some game modes.
   */
  @Immutable
  public abstract static class MineType extends CellContents {
    public final int count;

    protected MineType(Type type, int count) {
      super(type);
      checkArgument(count >= 1, "Mine-type contents must represent one or more mines: %s", count);
      this.count = count;
    }

    @Override public boolean equals(Object o) {
      if (o == this) return true;
      if (o == null || o.getClass() != getClass()) return false;
      return this.count == ((MineType) o).count;
    }

    @Override public int hashCode() {
      return type.hashCode() * 31 + count;
    }

    @Override public String toString() {
      return type.getSymbol() + Integer.toString(count);
    }
  }

  /** Flags placed by the player. */
  @Immutable
  public static final class Flag extends MineType {
    private Flag(int count) {
      super(Type.FLAG, count);
    }
  }

  /** Mines shown once a game is lost. */
  @Immutable
  public static final class Mine extends MineType {
    private Mine(int count) {
      super(Type.MINE, count);
    }
  }

  /** The mine that lost the game. */
  @Immutable
  public static final class HitMine extends MineType {
    private HitMine(int count) {
      super(Type.HIT_MINE, count);
    }
  }

  /** A flag shown to be wrong once a game is lost: the cell holds no mine. */
  @Immutable
  public static final class WrongFlag extends MineType {
    private WrongFlag(int count) {
      super(Type.WRONG_FLAG, count);
    }
  }

  private static final Num[] NUMS;
  static {
    NUMS = new Num[25];
    for (int i = 0; i < NUMS.length; ++i)
      NUMS[i] = new Num(i);
  }
}
