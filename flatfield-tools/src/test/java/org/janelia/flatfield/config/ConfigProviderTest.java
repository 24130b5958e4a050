package org.janelia.flatfield.config;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Collections;

import org.janelia.flatfield.image.BorderMode;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

public class ConfigProviderTest {

    @Rule
    public TemporaryFolder testFolder = new TemporaryFolder();

    @Test
    public void defaultResources() {
        Config config = ConfigProvider.getInstance().fromDefaultResources().get();
        assertEquals(7, config.getIntegerPropertyValue("Correction.MaxChannels", 0));
        assertEquals(1, config.getDoublePropertyValue("Correction.DefaultChannel", 0), 0);
        assertEquals(50, config.getDoublePropertyValue("Correction.DefaultSigma", 0), 0);
        assertEquals(0.35, config.getDoublePropertyValue("Correction.DefaultSaturation", 0), 0);
        assertEquals(16, config.getIntegerPropertyValue("Correction.DefaultBitDepth", 0));
        assertEquals(BorderMode.EDGE_REPLICATE, config.getEnumPropertyValue("Correction.BorderMode", BorderMode.class, null));
    }

    @Test
    public void fileOverridesDefaults() throws Exception {
        File configFile = testFolder.newFile("override.properties");
        Files.write(configFile.toPath(),
                Arrays.asList("Correction.MaxChannels=9", "Correction.BorderMode=mirror"),
                StandardCharsets.UTF_8);
        Config config = ConfigProvider.getInstance()
                .fromDefaultResources()
                .fromFile(configFile.getAbsolutePath())
                .get();
        assertEquals(9, config.getIntegerPropertyValue("Correction.MaxChannels", 0));
        assertEquals(BorderMode.MIRROR, config.getEnumPropertyValue("Correction.BorderMode", BorderMode.class, null));
        assertEquals(16, config.getIntegerPropertyValue("Correction.DefaultBitDepth", 0));
    }

    @Test
    public void blankFileNameIsIgnored() {
        Config config = ConfigProvider.getInstance().fromFile(" ").get();
        assertNull(config.getStringPropertyValue("Correction.MaxChannels"));
        assertEquals(3, config.getIntegerPropertyValue("Correction.MaxChannels", 3));
    }

    @Test(expected = IllegalArgumentException.class)
    public void missingFile() {
        ConfigProvider.getInstance().fromFile(new File(testFolder.getRoot(), "missing.properties").getAbsolutePath());
    }

    @Test(expected = IllegalArgumentException.class)
    public void invalidNumber() {
        ConfigProvider.getInstance()
                .fromMap(Collections.singletonMap("Correction.MaxChannels", "seven"))
                .get()
                .getIntegerPropertyValue("Correction.MaxChannels", 7);
    }
}
