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

import mmcorej.org.json.JSONException;
import mmcorej.org.json.JSONObject;

/**
 * Convenience/standardization for image and summary metadata
 */
public class StackEngMetadata {

   private static final String WIDTH = "Width";
   private static final String HEIGHT = "Height";
   private static final String PIX_TYPE = "PixelType";
   private static final String BAYER_PATTERN = "BayerPattern";
   private static final String ORIGIN = "Origin";
   private static final String DESTINATION = "Destination";
   private static final String CAMERA = "Camera";
   private static final String STACK_SIZE = "StackSize";

   public static final String PIX_TYPE_GRAY8 = "GRAY8";
   public static final String PIX_TYPE_GRAY16 = "GRAY16";
   public static final String PIX_TYPE_GRAY32 = "GRAY32";
   public static final String PIX_TYPE_RGB32 = "RGB32";

   public static JSONObject copy(JSONObject map) {
      try {
         return new JSONObject(map.toString());
      } catch (JSONException e) {
         throw new RuntimeException("Couldn't copy image tags");
      }
   }

   public static void setWidth(JSONObject map, int width) {
      try {
         map.put(WIDTH, width);
      } catch (JSONException ex) {
         throw new RuntimeException("Couldn't set image width");
      }
   }

   public static boolean hasWidth(JSONObject map) {
      return map.has(WIDTH);
   }

   public static int getWidth(JSONObject map) {
      try {
         return map.getInt(WIDTH);
      } catch (JSONException ex) {
         throw new RuntimeException("Image width tag missing");
      }
   }

   public static void setHeight(JSONObject map, int height) {
      try {
         map.put(HEIGHT, height);
      } catch (JSONException ex) {
         throw new RuntimeException("Couldn't set image height");
      }
   }

   public static int getHeight(JSONObject map) {
      try {
         return map.getInt(HEIGHT);
      } catch (JSONException ex) {
         throw new RuntimeException("Image height tag missing");
      }
   }

   public static void setPixelType(JSONObject map, String type) {
      try {
         map.put(PIX_TYPE, type);
      } catch (JSONException ex) {
         throw new RuntimeException("Couldn't set pixel type");
      }
   }

   public static boolean hasPixelType(JSONObject map) {
      return map.has(PIX_TYPE);
   }

   public static String getPixelType(JSONObject map) {
      try {
         return map.getString(PIX_TYPE);
      } catch (JSONException ex) {
         throw new RuntimeException("Missing pixel type tag");
      }
   }

   public static void setBayerPattern(JSONObject map, String pattern) {
      try {
         map.put(BAYER_PATTERN, pattern == null ? "" : pattern);
      } catch (JSONException ex) {
         throw new RuntimeException("Couldn't set bayer pattern");
      }
   }

   /**
    * @return the 2x2 color filter pattern, or an empty string for full color or mono images
    */
   public static String getBayerPattern(JSONObject map) {
      return map.optString(BAYER_PATTERN, "");
   }

   public static void setOrigin(JSONObject map, String origin) {
      try {
         map.put(ORIGIN, origin);
      } catch (JSONException ex) {
         throw new RuntimeException("Couldn't set image origin");
      }
   }

   public static String getOrigin(JSONObject map) {
      return map.optString(ORIGIN, "");
   }

   public static void setDestination(JSONObject map, String destination) {
      try {
         map.put(DESTINATION, destination);
      } catch (JSONException ex) {
         throw new RuntimeException("Couldn't set image destination");
      }
   }

   public static boolean hasDestination(JSONObject map) {
      return map.has(DESTINATION);
   }

   public static String getDestination(JSONObject map) {
      try {
         return map.getString(DESTINATION);
      } catch (JSONException ex) {
         throw new RuntimeException("Missing destination tag");
      }
   }

   public static boolean hasCamera(JSONObject map) {
      return map.has(CAMERA);
   }

   public static String getCamera(JSONObject map) {
      return map.optString(CAMERA, "");
   }

   public static void setStackSize(JSONObject map, int size) {
      try {
         map.put(STACK_SIZE, size);
      } catch (JSONException ex) {
         throw new RuntimeException("Couldn't set stack size");
      }
   }

   public static int getStackSize(JSONObject map) {
      return map.optInt(STACK_SIZE, 0);
   }

}
