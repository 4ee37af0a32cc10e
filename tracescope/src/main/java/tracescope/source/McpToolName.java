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

package tracescope.source;

/**
 * A tool name split into its MCP server and tool parts. Names of the form
 * {@code mcp__<server>__<tool>} are MCP tools; the tool part may itself contain
 * {@code __}. Any other name, or one with an empty server or tool part, is not.
 */
public final class McpToolName {
  private static final String PREFIX = "mcp__";
  private static final String SEPARATOR = "__";
  private static final McpToolName NOT_MCP = new McpToolName(false, null, null);

  private final boolean mcp;
  private final String server;
  private final String tool;

  private McpToolName(boolean mcp, String server, String tool) {
    this.mcp = mcp;
    this.server = server;
    this.tool = tool;
  }

  public static McpToolName parse(String toolName) {
    if (toolName == null || !toolName.startsWith(PREFIX)) {
      return NOT_MCP;
    }
    String rest = toolName.substring(PREFIX.length());
    int separator = rest.indexOf(SEPARATOR);
    if (separator <= 0) {
      return NOT_MCP;
    }
    String tool = rest.substring(separator + SEPARATOR.length());
    if (tool.isEmpty()) {
      return NOT_MCP;
    }
    return new McpToolName(true, rest.substring(0, separator), tool);
  }

  public boolean isMcp() {
    return mcp;
  }

  /**
   * @return The server part, or null for a non-MCP tool.
   */
  public String getServer() {
    return server;
  }

  /**
   * @return The tool part, or null for a non-MCP tool.
   */
  public String getTool() {
    return tool;
  }

  @Override
  public String toString() {
    return mcp ? "McpToolName{server=" + server + ", tool=" + tool + '}' : "McpToolName{not mcp}";
  }
}
