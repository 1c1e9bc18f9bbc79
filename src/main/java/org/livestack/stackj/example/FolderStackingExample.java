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
package org.livestack.stackj.example;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.concurrent.CountDownLatch;
import org.livestack.stackj.api.ImageSaver;
import org.livestack.stackj.api.SessionAPI;
import org.livestack.stackj.io.ImageJImageSaver;
import org.livestack.stackj.main.SessionController;
import org.livestack.stackj.main.SessionException;
import org.livestack.stackj.main.SessionSettings;
import org.livestack.stackj.util.LoggingMessageHub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This class demonstrates how to run a live stacking session on a folder. Usage:
 * FolderStackingExample settings.json
 *
 * <p>Every image written into the scan folder is stacked; the processed stack is written to
 * the work folder after each new image. Stop with Ctrl-C.</p>
 */
public class FolderStackingExample {

   private static final Logger logger_ = LoggerFactory.getLogger(FolderStackingExample.class);

   public static void main(String[] args) throws IOException, InterruptedException {
      if (args.length < 1) {
         System.err.println("Usage: FolderStackingExample <settings.json>");
         System.exit(1);
      }
      SessionSettings settings = SessionSettings.load(Paths.get(args[0]));

      // Images leaving the post-process pipeline are written with ImageJ
      ImageSaver saver = new ImageJImageSaver();

      // Creating the controller starts the processing threads, but no images are read yet
      SessionAPI session = new SessionController(settings, saver, new LoggingMessageHub());

      CountDownLatch done = new CountDownLatch(1);
      Runtime.getRuntime().addShutdownHook(new Thread(() -> {
         session.saveFinalImage();
         session.shutdown();
         done.countDown();
      }, "Shutdown hook"));

      try {
         session.startSession();
      } catch (SessionException e) {
         logger_.error("Could not start session: {}", e.getDetails());
         session.shutdown();
         System.exit(1);
      }
      done.await();
   }
}
