package org.lokray.thor.util;

import org.junit.jupiter.api.Test;

import java.io.File;
import java.nio.file.Paths;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class CompilerConfigTest
{
	@Test
	public void testDefaults()
	{
		CompilerConfig config = new CompilerConfig();

		assertEquals(".thor", config.getSourceExtension());
		assertTrue(config.getSearchPaths().isEmpty());
		assertEquals("thor_", config.getHelperPrefix());
		assertEquals(4, config.getIndentWidth());
		assertEquals(1024, config.getBufferSize());
	}

	@Test
	public void testPropertiesOverrideDefaults()
	{
		Properties props = new Properties();
		props.setProperty("thor.source_extension", "th");
		props.setProperty("thor.search_paths", "lib" + File.pathSeparator + " vendor ");
		props.setProperty("codegen.buffer_size", "4096");

		CompilerConfig config = new CompilerConfig(props);

		assertEquals(".th", config.getSourceExtension());
		assertEquals(List.of(Paths.get("lib"), Paths.get("vendor")), config.getSearchPaths());
		assertEquals(4096, config.getBufferSize());
	}

	@Test
	public void testWithSearchPathsAppends()
	{
		Properties props = new Properties();
		props.setProperty("thor.search_paths", "lib");

		CompilerConfig config = new CompilerConfig(props).withSearchPaths(List.of(Paths.get("extra")));

		assertEquals(List.of(Paths.get("lib"), Paths.get("extra")), config.getSearchPaths());
		assertEquals("thor_", config.getHelperPrefix());
	}

	@Test
	public void testInvalidNumbersAreRejected()
	{
		Properties negative = new Properties();
		negative.setProperty("codegen.indent", "-1");
		Properties garbage = new Properties();
		garbage.setProperty("codegen.buffer_size", "lots");

		assertThrows(IllegalArgumentException.class, () -> new CompilerConfig(negative));
		assertThrows(IllegalArgumentException.class, () -> new CompilerConfig(garbage));
	}
}
