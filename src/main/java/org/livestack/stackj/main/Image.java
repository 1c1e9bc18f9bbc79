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

import mmcorej.TaggedImage;
import mmcorej.org.json.JSONObject;

/**
 * The canonical in-memory frame: float sample planes plus a tag map holding sensor and
 * provenance metadata (see {@link StackEngMetadata}).
 *
 * Width, height and plane count never change for a given instance. Processing stages that
 * change the layout (e.g. debayering) build a new Image. Whoever currently holds an Image
 * owns it exclusively; anything that needs to keep one after handing it on must
 * {@link #copy()} it.
 */
public class Image {

   private final int width_;
   private final int height_;
   private final float[][] planes_;
   private final JSONObject tags_;

   public Image(int width, int height, float[][] planes, JSONObject tags) {
      if (width <= 0 || height <= 0) {
         throw new IllegalArgumentException("Invalid image size " + width + "x" + height);
      }
      if (planes == null || (planes.length != 1 && planes.length != 3)) {
         throw new IllegalArgumentException("An image has either 1 or 3 sample planes");
      }
      for (float[] plane : planes) {
         if (plane == null || plane.length != width * height) {
            throw new IllegalArgumentException("Sample plane does not match image size");
         }
      }
      width_ = width;
      height_ = height;
      planes_ = planes;
      tags_ = tags == null ? new JSONObject() : tags;
      StackEngMetadata.setWidth(tags_, width);
      StackEngMetadata.setHeight(tags_, height);
   }

   /**
    * Single plane image with fresh tags
    */
   public Image(int width, int height, float[] samples) {
      this(width, height, new float[][]{samples}, null);
   }

   /**
    * Build an Image from a camera frame. Pixel layout is taken from the Width, Height and
    * PixelType tags; 8 and 16 bit data is read as unsigned.
    */
   public static Image fromTaggedImage(TaggedImage ti) {
      if (ti == null || ti.pix == null || ti.tags == null) {
         throw new IllegalArgumentException("Tagged image has no pixels or no tags");
      }
      int width = StackEngMetadata.getWidth(ti.tags);
      int height = StackEngMetadata.getHeight(ti.tags);
      int numPixels = width * height;
      float[][] planes;
      if (ti.pix instanceof byte[]) {
         byte[] pix = (byte[]) ti.pix;
         if (pix.length == numPixels * 4) {
            // RGB32 frames are stored as BGRA
            planes = new float[3][numPixels];
            for (int i = 0; i < numPixels; i++) {
               planes[0][i] = pix[4 * i + 2] & 0xff;
               planes[1][i] = pix[4 * i + 1] & 0xff;
               planes[2][i] = pix[4 * i] & 0xff;
            }
         } else {
            planes = new float[1][numPixels];
            for (int i = 0; i < numPixels; i++) {
               planes[0][i] = pix[i] & 0xff;
            }
         }
      } else if (ti.pix instanceof short[]) {
         short[] pix = (short[]) ti.pix;
         planes = new float[1][numPixels];
         for (int i = 0; i < numPixels; i++) {
            planes[0][i] = pix[i] & 0xffff;
         }
      } else if (ti.pix instanceof int[]) {
         int[] pix = (int[]) ti.pix;
         planes = new float[3][numPixels];
         for (int i = 0; i < numPixels; i++) {
            planes[0][i] = (pix[i] >> 16) & 0xff;
            planes[1][i] = (pix[i] >> 8) & 0xff;
            planes[2][i] = pix[i] & 0xff;
         }
      } else if (ti.pix instanceof float[]) {
         planes = new float[][]{((float[]) ti.pix).clone()};
      } else {
         throw new IllegalArgumentException("Unsupported pixel array type: "
               + ti.pix.getClass().getSimpleName());
      }
      for (float[] plane : planes) {
         if (plane.length != numPixels) {
            throw new IllegalArgumentException("Pixel count does not match image tags");
         }
      }
      return new Image(width, height, planes, StackEngMetadata.copy(ti.tags));
   }

   public int getWidth() {
      return width_;
   }

   public int getHeight() {
      return height_;
   }

   public int getPlaneCount() {
      return planes_.length;
   }

   public boolean isColor() {
      return planes_.length == 3;
   }

   /**
    * Live reference to one sample plane, row-major
    */
   public float[] getPlane(int index) {
      return planes_[index];
   }

   public float getSample(int plane, int x, int y) {
      return planes_[plane][y * width_ + x];
   }

   public JSONObject getTags() {
      return tags_;
   }

   public String getBayerPattern() {
      return StackEngMetadata.getBayerPattern(tags_);
   }

   public void setBayerPattern(String pattern) {
      StackEngMetadata.setBayerPattern(tags_, pattern);
   }

   public boolean needsDebayering() {
      return planes_.length == 1 && !getBayerPattern().isEmpty();
   }

   public String getOrigin() {
      return StackEngMetadata.getOrigin(tags_);
   }

   public void setOrigin(String origin) {
      StackEngMetadata.setOrigin(tags_, origin);
   }

   public String getDestination() {
      return StackEngMetadata.hasDestination(tags_)
            ? StackEngMetadata.getDestination(tags_) : null;
   }

   public void setDestination(String destination) {
      StackEngMetadata.setDestination(tags_, destination);
   }

   public boolean hasSameGeometry(Image other) {
      return other != null && other.width_ == width_ && other.height_ == height_
            && other.planes_.length == planes_.length;
   }

   /**
    * New image with the same size and a copy of these tags, but different sample planes
    */
   public Image withPlanes(float[][] planes) {
      return new Image(width_, height_, planes, StackEngMetadata.copy(tags_));
   }

   /**
    * Deep copy of samples and tags
    */
   public Image copy() {
      float[][] planes = new float[planes_.length][];
      for (int i = 0; i < planes_.length; i++) {
         planes[i] = planes_[i].clone();
      }
      return withPlanes(planes);
   }

   @Override
   public String toString() {
      return "Image " + width_ + "x" + height_ + "x" + planes_.length
            + (getBayerPattern().isEmpty() ? "" : " " + getBayerPattern())
            + (getOrigin().isEmpty() ? "" : " from " + getOrigin());
   }
}
