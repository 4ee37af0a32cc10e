/*
 * Copyright 2014 WANdisco
 *
 *  WANdisco licenses this file to you under the Apache License,
 *  version 2.0 (the "License"); you may not use this file except in compliance
 *  with the License. You may obtain a copy of the License at:
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 *  WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 *  License for the specific language governing permissions and limitations
 *  under the License.
 */

package tracescope.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;

public class ToolTraceHookTest {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  @Rule
  public TemporaryFolder temporaryFolder = new TemporaryFolder();

  private static InputStream input(String text) {
    return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
  }

  private static List<String> lines(Path logFile) throws Exception {
    return Files.readAllLines(logFile, StandardCharsets.UTF_8);
  }

  @Test
  public void appendsOneEntryPerToolUse() throws Exception {
    Path logFile = temporaryFolder.getRoot().toPath().resolve("nested/dir/tool-trace.jsonl");
    String hookInput = "{\"session_id\": \"integration_test_session\", \"tool_use_id\": \"tu\","
        + " \"tool_name\": \"mcp__test__mock_tool\", \"permission_mode\": \"default\", \"cwd\": \"/test/dir\","
        + " \"tool_input\": {\"test_param\": \"test_value\"}, \"tool_response\": {\"status\": \"ok\"}}";

    assertThat(ToolTraceHook.run(input(hookInput), logFile), is(equalTo(0)));
    assertThat(ToolTraceHook.run(input(hookInput), logFile), is(equalTo(0)));

    List<String> lines = lines(logFile);
    assertThat(lines, hasSize(2));
    JsonNode entry = MAPPER.readTree(lines.get(0));
    assertThat(entry.get("session_id").asText(), is(equalTo("integration_test_session")));
    assertThat(entry.get("tool_name").asText(), is(equalTo("mcp__test__mock_tool")));
    assertThat(entry.get("is_mcp").asBoolean(), is(true));
    assertThat(entry.get("mcp_server").asText(), is(equalTo("test")));
    assertThat(entry.get("mcp_tool").asText(), is(equalTo("mock_tool")));
    assertThat(entry.get("status").asText(), is(equalTo("ok")));
  }

  @Test
  public void emptyOrBrokenInputStillSucceeds() throws Exception {
    Path logFile = temporaryFolder.getRoot().toPath().resolve("tool-trace.jsonl");

    assertThat(ToolTraceHook.run(input(""), logFile), is(equalTo(0)));
    assertThat(ToolTraceHook.run(input("{not json"), logFile), is(equalTo(0)));

    List<String> lines = lines(logFile);
    assertThat(lines, hasSize(2));
    assertThat(MAPPER.readTree(lines.get(1)).get("tool_name").asText(), is(equalTo("")));
  }

  @Test
  public void anUnwritableLogDoesNotFailTheHook() throws Exception {
    Path directory = temporaryFolder.newFolder("occupied").toPath();

    assertThat(ToolTraceHook.run(input("{\"tool_name\": \"Read\"}"), directory), is(equalTo(0)));
  }
}
