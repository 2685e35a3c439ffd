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
package us.blanshard.minesweeper.json;

import us.blanshard.minesweeper.board.CellContents;
import us.blanshard.minesweeper.board.Coord;
import us.blanshard.minesweeper.board.GridBoard;
import us.blanshard.minesweeper.solver.ProbabilityResult;

import com.google.common.collect.Lists;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.io.StringWriter;
import java.util.List;

/**
 * Static methods that convert boards and probability results to and from
 * json.  A board is an object with a "rows" array, each row an array of
 * cells; revealed numbers are json numbers and other cells are strings in
 * the form read by {@link CellContents#fromString}.
 *
 * @author Luke Blanshard
 */
public class BoardJson {

  /** A convenience for reading and writing boards. */
  public static final Gson GSON = register(new GsonBuilder()).create();

  /**
   * Registers type adapters in the given builder so that cell contents and
   * boards can be serialized and deserialized.
   */
  public static GsonBuilder register(GsonBuilder builder) {
    final TypeAdapter<CellContents> cellAdapter = new TypeAdapter<CellContents>() {
      @Override public void write(JsonWriter out, CellContents value) throws IOException {
        if (value.type == CellContents.Type.NUM) {
          out.value(((CellContents.Num) value).number);
        } else {
          out.value(value.toString());
        }
      }
      @Override public CellContents read(JsonReader in) throws IOException {
        try {
          if (in.peek() == JsonToken.NUMBER) return CellContents.num(in.nextInt());
          return CellContents.fromString(in.nextString());
        } catch (IllegalArgumentException e) {
          throw new JsonParseException("Bad cell at " + in.getPath(), e);
        }
      }
    };
    builder.registerTypeHierarchyAdapter(CellContents.class, cellAdapter);

    builder.registerTypeAdapter(GridBoard.class, new TypeAdapter<GridBoard>() {
      @Override public void write(JsonWriter out, GridBoard value) throws IOException {
        out.beginObject();
        out.name("rows").beginArray();
        for (int y = 0; y < value.getYSize(); ++y) {
          out.beginArray();
          for (int x = 0; x < value.getXSize(); ++x)
            cellAdapter.write(out, value.get(Coord.of(x, y)));
          out.endArray();
        }
        out.endArray();
        out.endObject();
      }
      @Override public GridBoard read(JsonReader in) throws IOException {
        List<List<CellContents>> rows = null;
        in.beginObject();
        while (in.hasNext()) {
          String name = in.nextName();
          if (name.equals("rows")) {
            rows = Lists.newArrayList();
            in.beginArray();
            while (in.hasNext()) {
              List<CellContents> row = Lists.newArrayList();
              in.beginArray();
              while (in.hasNext())
                row.add(cellAdapter.read(in));
              in.endArray();
              rows.add(row);
            }
            in.endArray();
          } else {
            in.skipValue();
          }
        }
        in.endObject();
        if (rows == null) throw new JsonParseException("Board has no rows");
        try {
          return GridBoard.fromRows(rows);
        } catch (IllegalArgumentException e) {
          throw new JsonParseException(e.getMessage(), e);
        }
      }
    });

    return builder;
  }

  public static GridBoard toBoard(String json) {
    return GSON.fromJson(json, GridBoard.class);
  }

  public static String fromBoard(GridBoard board) {
    return GSON.toJson(board);
  }

  /**
   * Writes a result's probabilities laid out like the given board, with null
   * for cells that have none, along with the configuration count and the
   * expected number of edge mines.
   */
  public static String fromResult(ProbabilityResult result, GridBoard board) {
    StringWriter sw = new StringWriter();
    JsonWriter out = new JsonWriter(sw);
    try {
      out.beginObject();
      out.name("probabilities").beginArray();
      for (int y = 0; y < board.getYSize(); ++y) {
        out.beginArray();
        for (int x = 0; x < board.getXSize(); ++x) {
          Double p = result.get(Coord.of(x, y));
          if (p == null) out.nullValue();
          else out.value(p.doubleValue());
        }
        out.endArray();
      }
      out.endArray();
      out.name("configurations").value(result.configurationCount);
      out.name("expectedEdgeMines").value(result.expectedEdgeMines);
      out.endObject();
      out.close();
    } catch (IOException e) {
      throw new AssertionError(e);  // StringWriter doesn't throw.
    }
    return sw.toString();
  }

  // Static methods only.
  private BoardJson() {}
}
