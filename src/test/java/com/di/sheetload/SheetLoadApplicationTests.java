package com.di.sheetload;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.DisplayName;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Basic smoke test for SheetLoadApplication.
 * Context start-up is not exercised here; only the entry point is checked.
 */
@DisplayName("SheetLoadApplication Tests")
class SheetLoadApplicationTests {

	@Test
	@DisplayName("Should have main class")
	void testMainClassExists() {
		Class<?> mainClass = SheetLoadApplication.class;
		assertNotNull(mainClass);
		assertEquals("SheetLoadApplication", mainClass.getSimpleName());
	}

	@Test
	@DisplayName("Should have main method")
	void testMainMethodExists() throws NoSuchMethodException {
		var mainMethod = SheetLoadApplication.class.getMethod("main", String[].class);
		assertNotNull(mainMethod);
		assertTrue(java.lang.reflect.Modifier.isStatic(mainMethod.getModifiers()));
		assertTrue(java.lang.reflect.Modifier.isPublic(mainMethod.getModifiers()));
	}

	@Test
	@DisplayName("Should recognise the command argument")
	void testCommandArgument() {
		assertTrue("--sheetload.command=load".startsWith(SheetLoadApplication.COMMAND_ARG));
	}
}
