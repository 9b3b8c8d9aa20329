/**
 * Copyright 2025 Fleak Tech Inc.
 *
 * <p>Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file
 * except in compliance with the License. You may obtain a copy of the License at
 *
 * <p>http://www.apache.org/licenses/LICENSE-2.0
 *
 * <p>Unless required by applicable law or agreed to in writing, software distributed under the
 * License is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.fleak.regexfn.lib.functions;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import io.fleak.regexfn.api.function.FunctionExecutionException;
import io.fleak.regexfn.api.function.ScalarFunction;
import io.fleak.regexfn.api.structure.ArrayValue;
import io.fleak.regexfn.api.structure.ColumnarValue;
import io.fleak.regexfn.api.structure.ScalarValue;
import io.fleak.regexfn.api.structure.StringBatch;
import io.fleak.regexfn.lib.config.RegexpExtractConfig;
import io.fleak.regexfn.lib.functions.strings.RegexpExtract;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class FunctionRegistryTest {

  @Test
  void testDefaultRegistry() {
    var registry = FunctionRegistry.defaultRegistry(RegexpExtractConfig.defaultConfig());
    assertEquals(Set.of(RegexpExtract.NAME), registry.getFunctionNames());
    assertInstanceOf(RegexpExtract.class, registry.lookupFunction("regexp_extract"));

    ColumnarValue out =
        registry.invoke(
            "regexp_extract",
            List.of(
                ArrayValue.of(StringBatch.of("abc123def")),
                ScalarValue.utf8("([a-z]+)(\\d+)"),
                ScalarValue.int64(2L)));
    assertEquals(StringBatch.of("123"), out.getStringBatch());
  }

  @Test
  void testUnknownFunction() {
    var registry = FunctionRegistry.defaultRegistry(RegexpExtractConfig.defaultConfig());
    var e =
        assertThrows(FunctionExecutionException.class, () -> registry.lookupFunction("regexp"));
    assertTrue(e.getMessage().contains("regexp"));
  }

  @Test
  void testDuplicateRegistration() {
    var config = RegexpExtractConfig.defaultConfig();
    var functions = List.of(new RegexpExtract(config), new RegexpExtract(config));
    assertThrows(IllegalArgumentException.class, () -> new FunctionRegistry(functions));
  }

  @Test
  void testInvokeDelegatesToFunction() {
    ScalarFunction fn = mock(ScalarFunction.class);
    when(fn.getName()).thenReturn("upper");
    ColumnarValue result = ArrayValue.of(StringBatch.of("A"));
    List<ColumnarValue> args = List.of(ArrayValue.of(StringBatch.of("a")));
    when(fn.invoke(args)).thenReturn(result);

    var registry = new FunctionRegistry(List.of(fn));

    assertSame(result, registry.invoke("upper", args));
    verify(fn).invoke(args);
  }
}
