package com.drawiomcp;

import com.drawiomcp.tools.BaseMcpTool;
import org.junit.jupiter.api.Test;
import org.reflections.Reflections;
import org.reflections.scanners.Scanners;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.lang.reflect.Modifier;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class ServiceRegistrationTest {

	private static final Logger log = LoggerFactory.getLogger(ServiceRegistrationTest.class);
	private static final String SERVICE_FILE_PATH = "META-INF/services/com.drawiomcp.tools.BaseMcpTool";
	private static final String BASE_PACKAGE = "com.drawiomcp.tools";

	@Test
	void testServiceRegistrationMatchesImplementations() throws Exception {
		Set<String> serviceFileClasses = readServiceFile();
		log.info("Found {} classes listed in service file.", serviceFileClasses.size());

		Set<String> foundToolClasses = findToolImplementations();
		log.info("Found {} concrete implementations of BaseMcpTool in package {}.", foundToolClasses.size(),
				BASE_PACKAGE);

		Set<String> missingFromServiceFile = new HashSet<>(foundToolClasses);
		missingFromServiceFile.removeAll(serviceFileClasses);

		Set<String> extraInServiceFile = new HashSet<>(serviceFileClasses);
		extraInServiceFile.removeAll(foundToolClasses);

		assertTrue(missingFromServiceFile.isEmpty(),
				"Service file is missing entries for the following tool(s). Please ADD them:\n  - "
						+ String.join("\n  - ", missingFromServiceFile));
		assertTrue(extraInServiceFile.isEmpty(),
				"The following tool(s) are listed in the service file but were NOT FOUND or do NOT extend BaseMcpTool:\n  - "
						+ String.join("\n  - ", extraInServiceFile));
		assertEquals(7, serviceFileClasses.size());
	}

	private Set<String> readServiceFile() throws Exception {
		Set<String> classes = new HashSet<>();
		InputStream is = getClass().getClassLoader().getResourceAsStream(SERVICE_FILE_PATH);
		if (is == null) {
			fail("Service file not found on classpath: " + SERVICE_FILE_PATH);
		}

		try (BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
			String line;
			while ((line = reader.readLine()) != null) {
				line = line.trim();
				if (!line.isEmpty() && !line.startsWith("#")) {
					classes.add(line);
				}
			}
		}
		return classes;
	}

	private Set<String> findToolImplementations() {
		Reflections reflections = new Reflections(BASE_PACKAGE, Scanners.SubTypes);

		Set<Class<? extends BaseMcpTool>> subTypes = reflections.getSubTypesOf(BaseMcpTool.class);

		// nested test doubles are not registered tools
		return subTypes.stream()
				.filter(cls -> !cls.isInterface() && !Modifier.isAbstract(cls.getModifiers()))
				.filter(cls -> cls.getEnclosingClass() == null)
				.map(Class::getName)
				.collect(Collectors.toSet());
	}
}
