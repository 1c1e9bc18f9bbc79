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
package org.livestack.stackj.io;

import java.nio.file.Paths;
import mmcorej.CMMCore;
import org.livestack.stackj.api.InputScanner;
import org.livestack.stackj.api.ScannerFactory;
import org.livestack.stackj.main.SessionSettings;

/**
 * Default scanner factory: "FS" watches the scan folder, "CAMERA" drives a Micro-Manager
 * camera
 */
public class InputScanners implements ScannerFactory {

   private final CMMCore core_;
   private final RawDecoder rawDecoder_;

   public InputScanners() {
      this(null, null);
   }

   /**
    * @param core Micro-Manager core for camera input, may be null if only folders are used
    * @param rawDecoder decoder for camera raw files, may be null
    */
   public InputScanners(CMMCore core, RawDecoder rawDecoder) {
      core_ = core;
      rawDecoder_ = rawDecoder;
   }

   @Override
   public InputScanner createScanner(SessionSettings settings) {
      return create(settings.getInputSystem(), settings);
   }

   public InputScanner create(String type, SessionSettings settings) {
      if (SessionSettings.INPUT_FOLDER.equals(type)) {
         return new FolderScanner(Paths.get(settings.getScanFolder()),
               new ImageReader(rawDecoder_), settings.getScanRetryPeriodMs());
      } else if (SessionSettings.INPUT_CAMERA.equals(type)) {
         return new CameraScanner(core_, settings.getCameraDevice(),
               settings.getCameraIntervalMs());
      }
      throw new IllegalArgumentException("Unsupported input system: " + type);
   }
}
