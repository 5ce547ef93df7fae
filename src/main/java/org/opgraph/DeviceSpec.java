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

import java.util.Locale;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A (partial) device specification, {@code /job:<name>/replica:<id>/task:<id>/device:<type>:<id>}.
 *
 * <p>Every field is optional. Short forms such as {@code "/GPU:0"}, {@code "/cpu:*"} or {@code
 * "/device:CPU"} are accepted; the {@code CPU} and {@code GPU} types are upper-cased. {@link
 * #toString()} renders the canonical form, so {@code DeviceSpec.parse("/gpu:0").toString()} is
 * {@code "/device:GPU:0"}.
 *
 * <p>Instances are immutable.
 */
public final class DeviceSpec {

  /** A specification with no field set. */
  public static final DeviceSpec EMPTY = new DeviceSpec(null, null, null, null, null);

  /**
   * Parses a device specification string.
   *
   * @throws IllegalArgumentException if {@code spec} is malformed
   */
  public static DeviceSpec parse(String spec) {
    String job = null;
    Integer replica = null;
    Integer task = null;
    String deviceType = null;
    Integer deviceIndex = null;
    for (String part : spec.split("/")) {
      if (part.isEmpty()) {
        continue;
      }
      String[] fields = part.split(":", -1);
      if (fields.length == 2 && fields[0].equals("job")) {
        job = fields[1];
      } else if (fields.length == 2 && fields[0].equals("replica")) {
        replica = parseIndex(spec, fields[1]);
      } else if (fields.length == 2 && fields[0].equals("task")) {
        task = parseIndex(spec, fields[1]);
      } else if (fields.length == 2 && fields[0].equals("device")) {
        deviceType = normalizeType(fields[1]);
      } else if (fields.length == 2) {
        deviceType = normalizeType(fields[0]);
        deviceIndex = parseWildcardIndex(spec, fields[1]);
      } else if (fields.length == 3 && fields[0].equals("device")) {
        deviceType = normalizeType(fields[1]);
        deviceIndex = parseWildcardIndex(spec, fields[2]);
      } else {
        throw new IllegalArgumentException(
            String.format("Unknown field '%s' in device specification '%s'", part, spec));
      }
    }
    return new DeviceSpec(job, replica, task, deviceType, deviceIndex);
  }

  /**
   * Combines two specifications field by field: every field set in {@code override} replaces the
   * one of {@code base}, other fields keep the value of {@code base}.
   */
  public static DeviceSpec merge(DeviceSpec base, DeviceSpec override) {
    return new DeviceSpec(
        override.job != null ? override.job : base.job,
        override.replica != null ? override.replica : base.replica,
        override.task != null ? override.task : base.task,
        override.deviceType != null ? override.deviceType : base.deviceType,
        override.deviceType != null ? override.deviceIndex : base.deviceIndex);
  }

  public @Nullable String job() {
    return job;
  }

  public @Nullable Integer replica() {
    return replica;
  }

  public @Nullable Integer task() {
    return task;
  }

  public @Nullable String deviceType() {
    return deviceType;
  }

  /** Index of the device, or null if unspecified or a wildcard. */
  public @Nullable Integer deviceIndex() {
    return deviceIndex;
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof DeviceSpec)) {
      return false;
    }
    return toString().equals(o.toString());
  }

  @Override
  public int hashCode() {
    return Objects.hash(job, replica, task, deviceType, deviceIndex);
  }

  /** Returns the canonical string form, empty when no field is set. */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    if (job != null) {
      sb.append("/job:").append(job);
    }
    if (replica != null) {
      sb.append("/replica:").append(replica);
    }
    if (task != null) {
      sb.append("/task:").append(task);
    }
    if (deviceType != null) {
      sb.append("/device:").append(deviceType).append(':');
      sb.append(deviceIndex == null ? "*" : deviceIndex.toString());
    }
    return sb.toString();
  }

  private DeviceSpec(
      @Nullable String job,
      @Nullable Integer replica,
      @Nullable Integer task,
      @Nullable String deviceType,
      @Nullable Integer deviceIndex) {
    this.job = job;
    this.replica = replica;
    this.task = task;
    this.deviceType = deviceType;
    this.deviceIndex = deviceIndex;
  }

  private static String normalizeType(String type) {
    String upper = type.toUpperCase(Locale.ROOT);
    return upper.equals("CPU") || upper.equals("GPU") ? upper : type;
  }

  private static Integer parseIndex(String spec, String value) {
    try {
      return Integer.valueOf(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          String.format("Invalid index '%s' in device specification '%s'", value, spec), e);
    }
  }

  private static @Nullable Integer parseWildcardIndex(String spec, String value) {
    return value.equals("*") ? null : parseIndex(spec, value);
  }

  private final @Nullable String job;
  private final @Nullable Integer replica;
  private final @Nullable Integer task;
  private final @Nullable String deviceType;
  private final @Nullable Integer deviceIndex;
}
