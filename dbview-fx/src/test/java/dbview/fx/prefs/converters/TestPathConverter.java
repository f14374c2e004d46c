package dbview.fx.prefs.converters;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import dbview.fx.prefs.PreferenceManager;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import java.util.prefs.BackingStoreException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class TestPathConverter {

    private static List<Path> provideDirectories() {
        return Arrays.asList(
                Paths.get("studies").resolve("patient 1").toAbsolutePath(),
                Paths.get("exports", "T1 series"),
                null);
    }

    @ParameterizedTest
    @MethodSource("provideDirectories")
    void testToStringFromString(Path value) {
        var converter = new PathConverter();
        assertEquals(value, converter.fromString(converter.toString(value)));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "  ", "\t"})
    void testBlankIsNoPath(String blank) {
        assertNull(new PathConverter().fromString(blank));
    }

    @Test
    void testLastDirectoryPersisted(@TempDir Path dir) throws BackingStoreException {
        var pathName = "dbview-test/" + UUID.randomUUID();
        var manager = PreferenceManager.createForUserPreferences(pathName);
        try {
            var lastDirectory = manager.createPersistentPathProperty("lastDirectory", null);
            assertNull(lastDirectory.get());

            lastDirectory.set(dir);
            assertEquals(dir.toString(), manager.getPreferences().get("lastDirectory", null));
            var other = PreferenceManager.createForUserPreferences(pathName);
            assertEquals(dir, other.createPersistentPathProperty("lastDirectory", null).get());

            // Clearing the directory removes it from the store
            lastDirectory.set(null);
            assertNull(manager.getPreferences().get("lastDirectory", null));

            // A blank stored value falls back to the default
            manager.getPreferences().put("lastDirectory", " ");
            manager.reload();
            assertNull(lastDirectory.get());
        } finally {
            manager.getPreferences().removeNode();
        }
    }

}
