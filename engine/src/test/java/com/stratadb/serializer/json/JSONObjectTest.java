/*
 * Copyright © 2021-present Arcade Data Ltd (info@arcadedata.com)
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
 * limitations under the License.
 *
 * SPDX-FileCopyrightText: 2021-present Arcade Data Ltd (info@arcadedata.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.stratadb.serializer.json;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JSONObjectTest {

  @Test
  void typedAccess() {
    final JSONObject json = new JSONObject("{'name':'orders','count':3,'offset':5000000000,'ratio':0.5,'ok':true,'none':null}");

    assertThat(json.getString("name")).isEqualTo("orders");
    assertThat(json.getInt("count")).isEqualTo(3);
    assertThat(json.getLong("offset")).isEqualTo(5_000_000_000L);
    assertThat(json.get("count")).isEqualTo(3);
    assertThat(json.get("offset")).isEqualTo(5_000_000_000L);
    assertThat(json.get("ratio")).isEqualTo(0.5);
    assertThat(json.getBoolean("ok")).isTrue();
    assertThat(json.isNull("none")).isTrue();
    assertThat(json.isNull("missing")).isTrue();
    assertThat(json.optString("missing", "x")).isEqualTo("x");

    assertThatThrownBy(() -> json.getString("missing")).isInstanceOf(JSONException.class);
  }

  @Test
  void nestedStructures() {
    final JSONObject json = new JSONObject();
    json.put("values", new JSONArray(List.of("a", "b")));
    json.put("meta", new JSONObject(Map.of("version", 1)));

    final JSONObject parsed = new JSONObject(json.toString());
    assertThat(parsed.getJSONArray("values").toList()).containsExactly("a", "b");
    assertThat(parsed.getJSONObject("meta").getInt("version")).isEqualTo(1);
    assertThat(parsed.toMap()).containsEntry("values", List.of("a", "b"));
    assertThat(parsed).isEqualTo(json);
  }

  @Test
  void invalidContent() {
    assertThatThrownBy(() -> new JSONObject("[1,2]")).isInstanceOf(JSONException.class);
    assertThatThrownBy(() -> new JSONArray("{}")).isInstanceOf(JSONException.class);
  }

  @Test
  void noHtmlEscaping() {
    final JSONObject json = new JSONObject();
    json.put("value", "<a&b>");
    assertThat(json.toString()).isEqualTo("{\"value\":\"<a&b>\"}");
  }
}
