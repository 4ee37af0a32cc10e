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

/**
 Each stage of the pipeline is a module with a narrow interface in this package, so the
 dependencies between the bus, the channels, the critic and the transport stay explicit.

 The root interface is {@link tracescope.interfaces.TracescopeModule}. The
 {@link tracescope.interfaces.PipelineServer} owns the shared resources (the fiber pool and
 configuration) and hands out the running modules.
 */
package tracescope.interfaces;
