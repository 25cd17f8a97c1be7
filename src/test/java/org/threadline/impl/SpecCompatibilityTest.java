/*
 * Copyright 2025 The Threadline Authors
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
 */

package org.threadline.impl;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.threadline.impl.SpecCompatibility.inputSpecsCompatible;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class SpecCompatibilityTest {

  @Test
  public void unknownDimensionsMatchAnything() {
    InputSpec src = InputSpec.of(DataType.FLOAT32, null, 3);
    InputSpec desired = InputSpec.of(DataType.FLOAT32, 8, 3);
    InputSpec negative = InputSpec.of(DataType.FLOAT32, 8, -1);
    assertThat(inputSpecsCompatible(ImmutableList.of(src), ImmutableList.of(desired))).isTrue();
    assertThat(inputSpecsCompatible(ImmutableList.of(negative), ImmutableList.of(desired)))
        .isTrue();
  }

  @Test
  public void knownDimensionsMustAgree() {
    InputSpec src = InputSpec.of(DataType.FLOAT32, 4, 3);
    InputSpec desired = InputSpec.of(DataType.FLOAT32, 8, 3);
    assertThat(inputSpecsCompatible(ImmutableList.of(src), ImmutableList.of(desired))).isFalse();
  }

  @Test
  public void rankAndDtypeMustAgree() {
    InputSpec matrix = InputSpec.of(DataType.FLOAT32, null, null);
    InputSpec vector = InputSpec.of(DataType.FLOAT32, (Integer) null);
    InputSpec ints = InputSpec.of(DataType.INT64, null, null);
    assertThat(inputSpecsCompatible(ImmutableList.of(matrix), ImmutableList.of(vector))).isFalse();
    assertThat(inputSpecsCompatible(ImmutableList.of(matrix), ImmutableList.of(ints))).isFalse();
  }

  @Test
  public void tensorSpecAgainstOtherValue() {
    InputSpec spec = InputSpec.of(DataType.FLOAT32, 2);
    assertThat(inputSpecsCompatible(ImmutableList.of(spec), ImmutableList.of(2))).isFalse();
    assertThat(inputSpecsCompatible(Arrays.asList((Object) null), ImmutableList.of(spec)))
        .isFalse();
  }

  @Test
  public void otherValuesCompareStructurally() {
    List<Object> src = Arrays.asList(1, new int[] {1, 2}, "mode", null);
    List<Object> same = Arrays.asList(1, ImmutableList.of(1, 2), "mode", null);
    List<Object> different = Arrays.asList(1, ImmutableList.of(1, 2), "other", null);
    assertThat(inputSpecsCompatible(src, same)).isTrue();
    assertThat(inputSpecsCompatible(src, different)).isFalse();
  }

  @Test
  public void subsetOfDifferentLength() {
    InputSpec x = new InputSpec(Arrays.asList(null, 4), DataType.FLOAT32, "x");
    InputSpec y = new InputSpec(Arrays.asList(2), DataType.INT64, "y");
    InputSpec z = new InputSpec(Arrays.asList(2), DataType.INT64, "z");
    assertThat(inputSpecsCompatible(ImmutableList.of(x), ImmutableList.of(y, x))).isTrue();
    assertThat(inputSpecsCompatible(ImmutableList.of(z), ImmutableList.of(x, y))).isFalse();
    assertThat(inputSpecsCompatible(ImmutableList.of(), ImmutableList.of(x))).isTrue();
  }

  @Test
  public void dataTypeNames() {
    assertThat(DataType.parse("float32")).isEqualTo(DataType.FLOAT32);
    assertThat(DataType.parse("FLOAT64")).isEqualTo(DataType.FLOAT64);
    assertThat(DataType.parse("double")).isEqualTo(DataType.FLOAT64);
    assertThrows(IllegalArgumentException.class, () -> DataType.parse("quad"));
  }

  @Test
  public void specToString() {
    assertThat(new InputSpec(Arrays.asList(null, 4), DataType.FLOAT32, "x").toString())
        .isEqualTo("InputSpec([None, 4], float32, 'x')");
  }
}
