/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
/**
 * <b>org.apache.apex.flow.api</b> package is the user facing API of Apex Flow.<p>
 * <br>
 * A program describes a chain of transformations over an unbounded sequence of records with
 * {@link org.apache.apex.flow.api.DataStream}. Every transformation adds a node to the stream graph which
 * is later compiled and executed by a runtime.<br>
 * <br>
 * The {@link org.apache.apex.flow.api.function} package holds the interfaces of the user functions,
 * {@link org.apache.apex.flow.api.Context} the attributes configuring the graph and its nodes.
 */

package org.apache.apex.flow.api;
