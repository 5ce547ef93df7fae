/* Copyright 2019 The TensorFlow Authors. All Rights Reserved.

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

    http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
==============================================================================*/

package org.opgraph;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.fail;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Unit tests for {@link DeviceSpec}. */
@RunWith(JUnit4.class)
public final class DeviceSpecTest {

  @Test
  public void parsesFullSpecifications() {
    DeviceSpec spec = DeviceSpec.parse("/job:worker/replica:1/task:2/device:GPU:3");
    assertThat(spec.job()).isEqualTo("worker");
    assertThat(spec.replica()).isEqualTo(1);
    assertThat(spec.task()).isEqualTo(2);
    assertThat(spec.deviceType()).isEqualTo("GPU");
    assertThat(spec.deviceIndex()).isEqualTo(3);
    assertThat(spec.toString()).isEqualTo("/job:worker/replica:1/task:2/device:GPU:3");
  }

  @Test
  public void parsesShorthands() {
    assertThat(DeviceSpec.parse("/gpu:0").toString()).isEqualTo("/device:GPU:0");
    assertThat(DeviceSpec.parse("/CPU:1").toString()).isEqualTo("/device:CPU:1");
    assertThat(DeviceSpec.parse("cpu:*").deviceIndex()).isNull();
    assertThat(DeviceSpec.parse("cpu:*").toString()).isEqualTo("/device:CPU:*");
    assertThat(DeviceSpec.parse("/device:TPU:2").deviceType()).isEqualTo("TPU");
  }

  @Test
  public void emptySpecification() {
    assertThat(DeviceSpec.parse("")).isEqualTo(DeviceSpec.EMPTY);
    assertThat(DeviceSpec.EMPTY.toString()).isEmpty();
  }

  @Test
  public void rejectsMalformedSpecifications() {
    for (String spec : new String[] {"/bogus", "/task:x", "/device:GPU:y", "/a:b:c:d"}) {
      try {
        DeviceSpec.parse(spec);
        fail("parsed '" + spec + "'");
      } catch (IllegalArgumentException e) {
        // expected
      }
    }
  }

  @Test
  public void mergeKeepsTheFieldsTheOverrideLeavesUnset() {
    DeviceSpec base = DeviceSpec.parse("/job:ps/device:GPU:0");
    assertThat(DeviceSpec.merge(base, DeviceSpec.parse("/task:1")).toString())
        .isEqualTo("/job:ps/task:1/device:GPU:0");
    assertThat(DeviceSpec.merge(base, DeviceSpec.parse("/cpu:*")).toString())
        .isEqualTo("/job:ps/device:CPU:*");
    assertThat(DeviceSpec.merge(base, DeviceSpec.EMPTY)).isEqualTo(base);
  }
}
