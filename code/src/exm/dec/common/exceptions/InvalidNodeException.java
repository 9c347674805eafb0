/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */

package exm.dec.common.exceptions;

/**
 * Thrown by the node builder when a required part of a node is missing
 * or invalid.  This is a caller error, not an evaluation error.
 */
public class InvalidNodeException extends IllegalArgumentException {

  private static final long serialVersionUID = 1L;

  public InvalidNodeException(String message) {
    super(message);
  }

  public static InvalidNodeException missing(String nodeKind, String part) {
    return new InvalidNodeException("cannot create " + nodeKind
                                  + ": " + part + " is missing");
  }
}
