///////////////////////////////////////////////////////////////////////////////
// COPYRIGHT:    StackEngJ contributors, 2026
//
// LICENSE:      This file is distributed under the BSD license.
//               License text is included with the source distribution.
//
//               This file is distributed in the hope that it will be useful,
//               but WITHOUT ANY WARRANTY; without even the implied warranty
//               of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.
//
//               IN NO EVENT SHALL THE COPYRIGHT OWNER OR
//               CONTRIBUTORS BE LIABLE FOR ANY DIRECT, INDIRECT,
//               INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES.
//
package org.livestack.stackj.main;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import mmcorej.org.json.JSONException;
import mmcorej.org.json.JSONObject;

/**
 * User preferences of a stacking session, persisted as a JSON file. Keys missing from the
 * file keep their defaults.
 */
public class SessionSettings {

   public static final String INPUT_SYSTEM = "InputSystem";
   public static final String SCAN_FOLDER = "ScanFolder";
   public static final String WORK_FOLDER = "WorkFolder";
   public static final String WEB_FOLDER = "WebFolder";
   public static final String STACKING_MODE = "StackingMode";
   public static final String ALIGN_BEFORE_STACK = "AlignBeforeStack";
   public static final String IMAGE_SAVE_FORMAT = "ImageSaveFormat";
   public static final String SAVE_EVERY_IMAGE = "SaveEveryImage";
   public static final String SCAN_RETRY_PERIOD_MS = "ScanRetryPeriodMs";
   public static final String CAMERA_DEVICE = "CameraDevice";
   public static final String CAMERA_INTERVAL_MS = "CameraIntervalMs";
   public static final String DARK_PATH = "DarkPath";

   public static final String INPUT_FOLDER = "FS";
   public static final String INPUT_CAMERA = "CAMERA";

   private String inputSystem_ = INPUT_FOLDER;
   private String scanFolder_;
   private String workFolder_;
   private String webFolder_;
   private String stackingMode_ = "mean";
   private boolean alignBeforeStack_ = true;
   private String imageSaveFormat_ = "tiff";
   private boolean saveEveryImage_ = false;
   private long scanRetryPeriodMs_ = 500;
   private String cameraDevice_;
   private double cameraIntervalMs_ = 0;
   private String darkPath_;

   public static SessionSettings load(Path file) throws IOException {
      String text = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
      try {
         return fromJSON(new JSONObject(text));
      } catch (JSONException e) {
         throw new IOException("Malformed settings file " + file, e);
      }
   }

   public void save(Path file) throws IOException {
      try {
         Files.write(file, toJSON().toString(2).getBytes(StandardCharsets.UTF_8));
      } catch (JSONException e) {
         throw new IOException("Couldn't write settings to " + file, e);
      }
   }

   public static SessionSettings fromJSON(JSONObject json) {
      SessionSettings s = new SessionSettings();
      s.inputSystem_ = json.optString(INPUT_SYSTEM, s.inputSystem_);
      s.scanFolder_ = optString(json, SCAN_FOLDER);
      s.workFolder_ = optString(json, WORK_FOLDER);
      s.webFolder_ = optString(json, WEB_FOLDER);
      s.stackingMode_ = json.optString(STACKING_MODE, s.stackingMode_);
      s.alignBeforeStack_ = json.optBoolean(ALIGN_BEFORE_STACK, s.alignBeforeStack_);
      s.imageSaveFormat_ = json.optString(IMAGE_SAVE_FORMAT, s.imageSaveFormat_);
      s.saveEveryImage_ = json.optBoolean(SAVE_EVERY_IMAGE, s.saveEveryImage_);
      s.scanRetryPeriodMs_ = json.optLong(SCAN_RETRY_PERIOD_MS, s.scanRetryPeriodMs_);
      s.cameraDevice_ = optString(json, CAMERA_DEVICE);
      s.cameraIntervalMs_ = json.optDouble(CAMERA_INTERVAL_MS, s.cameraIntervalMs_);
      s.darkPath_ = optString(json, DARK_PATH);
      return s;
   }

   public JSONObject toJSON() {
      JSONObject json = new JSONObject();
      try {
         json.put(INPUT_SYSTEM, inputSystem_);
         putIfSet(json, SCAN_FOLDER, scanFolder_);
         putIfSet(json, WORK_FOLDER, workFolder_);
         putIfSet(json, WEB_FOLDER, webFolder_);
         json.put(STACKING_MODE, stackingMode_);
         json.put(ALIGN_BEFORE_STACK, alignBeforeStack_);
         json.put(IMAGE_SAVE_FORMAT, imageSaveFormat_);
         json.put(SAVE_EVERY_IMAGE, saveEveryImage_);
         json.put(SCAN_RETRY_PERIOD_MS, scanRetryPeriodMs_);
         putIfSet(json, CAMERA_DEVICE, cameraDevice_);
         json.put(CAMERA_INTERVAL_MS, cameraIntervalMs_);
         putIfSet(json, DARK_PATH, darkPath_);
      } catch (JSONException e) {
         throw new RuntimeException("Couldn't convert settings to JSON", e);
      }
      return json;
   }

   private static String optString(JSONObject json, String key) {
      return json.has(key) && !json.isNull(key) ? json.optString(key) : null;
   }

   private static void putIfSet(JSONObject json, String key, String value)
         throws JSONException {
      if (value != null) {
         json.put(key, value);
      }
   }

   public String getInputSystem() {
      return inputSystem_;
   }

   public void setInputSystem(String inputSystem) {
      inputSystem_ = inputSystem;
   }

   public String getScanFolder() {
      return scanFolder_;
   }

   public void setScanFolder(String scanFolder) {
      scanFolder_ = scanFolder;
   }

   public String getWorkFolder() {
      return workFolder_;
   }

   public void setWorkFolder(String workFolder) {
      workFolder_ = workFolder;
   }

   /**
    * @return folder receiving the web preview image, or null to skip it
    */
   public String getWebFolder() {
      return webFolder_;
   }

   public void setWebFolder(String webFolder) {
      webFolder_ = webFolder;
   }

   public String getStackingMode() {
      return stackingMode_;
   }

   public void setStackingMode(String stackingMode) {
      stackingMode_ = stackingMode;
   }

   public boolean isAlignBeforeStack() {
      return alignBeforeStack_;
   }

   public void setAlignBeforeStack(boolean alignBeforeStack) {
      alignBeforeStack_ = alignBeforeStack;
   }

   public String getImageSaveFormat() {
      return imageSaveFormat_;
   }

   public void setImageSaveFormat(String imageSaveFormat) {
      imageSaveFormat_ = imageSaveFormat;
   }

   public boolean isSaveEveryImage() {
      return saveEveryImage_;
   }

   public void setSaveEveryImage(boolean saveEveryImage) {
      saveEveryImage_ = saveEveryImage;
   }

   public long getScanRetryPeriodMs() {
      return scanRetryPeriodMs_;
   }

   public void setScanRetryPeriodMs(long scanRetryPeriodMs) {
      scanRetryPeriodMs_ = scanRetryPeriodMs;
   }

   public String getCameraDevice() {
      return cameraDevice_;
   }

   public void setCameraDevice(String cameraDevice) {
      cameraDevice_ = cameraDevice;
   }

   /**
    * @return interval between camera frames in ms, 0 for as fast as possible
    */
   public double getCameraIntervalMs() {
      return cameraIntervalMs_;
   }

   public void setCameraIntervalMs(double cameraIntervalMs) {
      cameraIntervalMs_ = cameraIntervalMs;
   }

   public String getDarkPath() {
      return darkPath_;
   }

   public void setDarkPath(String darkPath) {
      darkPath_ = darkPath;
   }
}
