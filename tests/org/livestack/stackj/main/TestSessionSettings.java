package org.livestack.stackj.main;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import mmcorej.org.json.JSONObject;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class TestSessionSettings {

   @Rule
   public TemporaryFolder tmp = new TemporaryFolder();

   @Test
   public void testDefaults() {
      SessionSettings settings = new SessionSettings();
      Assert.assertEquals("FS", settings.getInputSystem());
      Assert.assertEquals("mean", settings.getStackingMode());
      Assert.assertTrue(settings.isAlignBeforeStack());
      Assert.assertEquals("tiff", settings.getImageSaveFormat());
      Assert.assertFalse(settings.isSaveEveryImage());
      Assert.assertEquals(500, settings.getScanRetryPeriodMs());
      Assert.assertNull(settings.getScanFolder());
      Assert.assertNull(settings.getWebFolder());
   }

   @Test
   public void testSaveAndLoad() throws Exception {
      SessionSettings settings = new SessionSettings();
      settings.setScanFolder("/data/scan");
      settings.setWorkFolder("/data/work");
      settings.setStackingMode("sigma-clip");
      settings.setAlignBeforeStack(false);
      settings.setImageSaveFormat("png");
      settings.setSaveEveryImage(true);
      settings.setScanRetryPeriodMs(250);
      settings.setCameraDevice("Camera");
      Path file = tmp.newFile("settings.json").toPath();
      settings.save(file);

      SessionSettings loaded = SessionSettings.load(file);
      Assert.assertEquals("/data/scan", loaded.getScanFolder());
      Assert.assertEquals("/data/work", loaded.getWorkFolder());
      Assert.assertNull(loaded.getWebFolder());
      Assert.assertEquals("sigma-clip", loaded.getStackingMode());
      Assert.assertFalse(loaded.isAlignBeforeStack());
      Assert.assertEquals("png", loaded.getImageSaveFormat());
      Assert.assertTrue(loaded.isSaveEveryImage());
      Assert.assertEquals(250, loaded.getScanRetryPeriodMs());
      Assert.assertEquals("Camera", loaded.getCameraDevice());
   }

   @Test
   public void testMissingKeysKeepDefaults() throws Exception {
      JSONObject json = new JSONObject("{\"ScanFolder\": \"/in\"}");
      SessionSettings settings = SessionSettings.fromJSON(json);
      Assert.assertEquals("/in", settings.getScanFolder());
      Assert.assertEquals("mean", settings.getStackingMode());
      Assert.assertTrue(settings.isAlignBeforeStack());
   }

   @Test(expected = IOException.class)
   public void testMalformedFileIsAnIOException() throws Exception {
      Path file = tmp.newFile("broken.json").toPath();
      Files.write(file, "{ not json".getBytes("UTF-8"));
      SessionSettings.load(file);
   }
}
