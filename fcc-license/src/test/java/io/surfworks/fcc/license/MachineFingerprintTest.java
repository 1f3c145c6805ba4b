package io.surfworks.fcc.license;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeFalse;

/**
 * Tests for {@link MachineFingerprint}.
 */
class MachineFingerprintTest {

    @Test
    @DisplayName("generate returns consistent fingerprint")
    void generate_isConsistent() {
        String fp1 = MachineFingerprint.generate();
        String fp2 = MachineFingerprint.generate();

        assertEquals(fp1, fp2);
    }

    @Test
    @DisplayName("generate returns 64-character lowercase hex string")
    void generate_returns64CharHex() {
        String fingerprint = MachineFingerprint.generate();

        assertEquals(64, fingerprint.length());
        assertTrue(fingerprint.matches("[0-9a-f]+"));
    }

    @Test
    @DisplayName("components are recomputed identically")
    void components_areDeterministic() {
        assertEquals(
            MachineFingerprint.fromComponents(MachineFingerprint.components()),
            MachineFingerprint.fromComponents(MachineFingerprint.components())
        );
    }

    @Test
    @DisplayName("components include host, OS, arch, version, MAC and UUID slots")
    void components_haveSixSlots() {
        List<String> components = MachineFingerprint.components();

        assertEquals(6, components.size());
        assertEquals(System.getProperty("os.arch", ""), components.get(2));
        assertFalse(components.get(4).isBlank());
        assertFalse(components.get(5).isBlank());
    }

    @Test
    @DisplayName("fromComponents joins with '|' and skips blanks")
    void fromComponents_skipsBlanks() {
        String withBlank = MachineFingerprint.fromComponents(Arrays.asList("host", "", "Linux", null, "x86_64"));
        String without = MachineFingerprint.fromComponents(List.of("host", "Linux", "x86_64"));

        assertEquals(without, withBlank);
        assertEquals(MachineFingerprint.sha256Hex("host|Linux|x86_64"), without);
    }

    @Test
    @DisplayName("a different component changes the fingerprint")
    void fromComponents_differentInputs_differentHashes() {
        String a = MachineFingerprint.fromComponents(List.of("host-a", "Linux", MachineFingerprint.UUID_UNKNOWN));
        String b = MachineFingerprint.fromComponents(List.of("host-b", "Linux", MachineFingerprint.UUID_UNKNOWN));

        assertNotEquals(a, b);
    }

    @Test
    @DisplayName("sha256Hex matches a known vector")
    void sha256Hex_knownVector() {
        assertEquals(
            "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
            MachineFingerprint.sha256Hex("abc")
        );
    }

    @Test
    @DisplayName("getMachineName includes OS info")
    void getMachineName_includesOsInfo() {
        String name = MachineFingerprint.getMachineName();

        assertNotNull(name);
        assertTrue(name.contains("(") && name.endsWith(")"));

        String osName = System.getProperty("os.name", "").toLowerCase();
        if (osName.contains("mac")) {
            assertTrue(name.contains("macOS"));
        } else if (osName.contains("linux")) {
            assertTrue(name.contains("Linux"));
        }
    }

    @Test
    @DisplayName("getPlatform has name, version and arch parts without spaces")
    void getPlatform_format() {
        String platform = MachineFingerprint.getPlatform();

        assertFalse(platform.contains(" "));
        assertTrue(platform.endsWith("-" + System.getProperty("os.arch")));
    }

    @Test
    @DisplayName("runProbe returns the command output")
    void runProbe_readsOutput() throws Exception {
        assumeFalse(System.getProperty("os.name").toLowerCase().contains("windows"));

        assertEquals(List.of("hello"), MachineFingerprint.runProbe(5, "echo", "hello"));
    }

    @Test
    @DisplayName("runProbe gives up on a command that does not finish")
    void runProbe_hungCommand_timesOut() {
        assumeFalse(System.getProperty("os.name").toLowerCase().contains("windows"));

        List<String> lines = assertTimeoutPreemptively(Duration.ofSeconds(10),
            () -> MachineFingerprint.runProbe(1, "sleep", "30"));

        assertTrue(lines.isEmpty());
    }
}
