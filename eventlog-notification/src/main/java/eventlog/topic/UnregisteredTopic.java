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

package eventlog.topic;

import java.util.Collection;

/**
 * A topic was met, or required, that no decoder is registered for.
 */
public class UnregisteredTopic extends RuntimeException {
  public UnregisteredTopic(String topic) {
    super("No decoder registered for topic " + topic);
  }

  public UnregisteredTopic(Collection<String> topics) {
    super("No decoders registered for topics " + topics);
  }
}
