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
package us.blanshard.minesweeper.tools;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.io.Files;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;

public class ProbabilityToolTest {

  @Rule public TemporaryFolder folder = new TemporaryFolder();

  private final ByteArrayOutputStream out = new ByteArrayOutputStream();
  private final ByteArrayOutputStream err = new ByteArrayOutputStream();

  private int run(String... args) throws IOException {
    return ProbabilityTool.run(
        args, new PrintStream(out, true, "UTF-8"), new PrintStream(err, true, "UTF-8"));
  }

  private String boardFile(String name, String contents) throws IOException {
    File file = folder.newFile(name);
    Files.asCharSink(file, UTF_8).write(contents);
    return file.getPath();
  }

  @Test public void textBoard() throws IOException {
    String path = boardFile("board.txt", "F1 1 #\n");
    assertThat(run(path, "0")).isEqualTo(0);
    assertThat(out.toString("UTF-8")).contains("    -     -   0.0\n");
  }

  @Test public void jsonBoard() throws IOException {
    String path = boardFile("board.json", "{\"rows\": [[\"#\", 1, \"#\"]]}");
    assertThat(run(path, "1")).isEqualTo(0);
    assertThat(out.toString("UTF-8")).contains(" 50.0     -  50.0\n");
  }

  @Test public void ignoreFlags() throws IOException {
    String path = boardFile("board.txt", "F1 1 #\n");
    assertThat(run(path, "1")).isEqualTo(2);
    assertThat(err.toString("UTF-8")).startsWith("No probabilities: ");

    assertThat(run(ProbabilityTool.IGNORE_FLAGS, path, "1")).isEqualTo(0);
    assertThat(out.toString("UTF-8")).contains(" 50.0     -  50.0\n");
  }

  @Test public void badArguments() throws IOException {
    assertThat(run()).isEqualTo(1);
    assertThat(run("board.txt", "many")).isEqualTo(1);
    assertThat(run("board.txt", "1", "0")).isEqualTo(1);
    assertThat(err.toString("UTF-8")).contains(ProbabilityTool.USAGE);
  }
}
