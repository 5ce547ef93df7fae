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

/** Unit tests for {@link DataType}. */
@RunWith(JUnit4.class)
public final class DataTypeTest {

  @Test
  public void testFromCode() {
    for (DataType dtype : DataType.values()) {
      assertThat(DataType.fromCode(dtype.code())).isEqualTo(dtype);
    }
    try {
      DataType.fromCode(-1);
      fail("accepted an unknown type code");
    } catch (IllegalArgumentException e) {
      assertThat(e).hasMessageThat().contains("-1");
    }
  }

  @Test
  public void testFromClass() {
    assertThat(DataType.fromClass(Float.class)).isEqualTo(DataType.FLOAT);
    assertThat(DataType.fromClass(Long.class)).isEqualTo(DataType.INT64);
    assertThat(DataType.fromClass(String.class)).isEqualTo(DataType.STRING);
    try {
      DataType.fromClass(Object.class);
      fail("accepted Object elements");
    } catch (IllegalArgumentException e) {
      // expected
    }
  }

  @Test
  public void testKinds() {
    assertThat(DataType.FLOAT.isFloating()).isTrue();
    assertThat(DataType.INT32.isFloating()).isFalse();
    assertThat(DataType.UINT8.isInteger()).isTrue();
    assertThat(DataType.BOOL.isNumeric()).isFalse();
    assertThat(DataType.STRING.isNumeric()).isFalse();
    assertThat(DataType.DOUBLE.byteSize()).isEqualTo(8);
    assertThat(DataType.STRING.byteSize()).isEqualTo(-1);
  }
}
