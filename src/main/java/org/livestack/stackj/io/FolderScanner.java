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

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.livestack.stackj.api.InputScanner;
import org.livestack.stackj.api.MessageHub;
import org.livestack.stackj.api.ScannerStartException;
import org.livestack.stackj.internal.BackpressureGate;
import org.livestack.stackj.main.Image;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Watches a folder for new image files. Files already present when the scanner starts are
 * left alone. A new file is read once its size has stayed the same for one retry period,
 * so files still being written are not picked up early.
 */
public class FolderScanner implements InputScanner {

   private static final Logger logger_ = LoggerFactory.getLogger(FolderScanner.class);

   private final Path folder_;
   private final ImageReader reader_;
   private final long retryPeriodMs_;
   private final Set<String> seen_ = new HashSet<>();
   private final Map<String, Long> pendingSizes_ = new HashMap<>();
   private volatile Consumer<Image> listener_;
   private volatile BackpressureGate gate_;
   private volatile MessageHub messageHub_;
   private volatile boolean running_ = false;
   private ExecutorService executor_;

   public FolderScanner(Path folder, ImageReader reader, long retryPeriodMs) {
      folder_ = folder;
      reader_ = reader;
      retryPeriodMs_ = retryPeriodMs;
   }

   @Override
   public void setImageListener(Consumer<Image> listener) {
      listener_ = listener;
   }

   @Override
   public void setBackpressureGate(BackpressureGate gate) {
      gate_ = gate;
   }

   @Override
   public void setMessageHub(MessageHub messageHub) {
      messageHub_ = messageHub;
   }

   public Path getFolder() {
      return folder_;
   }

   @Override
   public synchronized void start() throws ScannerStartException {
      if (running_) {
         return;
      }
      if (folder_ == null || !Files.isDirectory(folder_)) {
         throw new ScannerStartException("Scan folder " + folder_ + " does not exist");
      }
      synchronized (seen_) {
         seen_.clear();
         pendingSizes_.clear();
         try {
            seen_.addAll(listFiles());
         } catch (IOException e) {
            throw new ScannerStartException("Could not list scan folder " + folder_, e);
         }
      }
      running_ = true;
      executor_ = Executors.newSingleThreadExecutor(r -> new Thread(r, "Folder scanner thread"));
      executor_.submit(this::run);
      logger_.info("Scanning {} for new images", folder_);
   }

   @Override
   public synchronized void stop() {
      if (executor_ == null) {
         return;
      }
      running_ = false;
      executor_.shutdownNow();
      try {
         if (!executor_.awaitTermination(10, TimeUnit.SECONDS)) {
            logger_.warn("Folder scanner thread did not stop in time");
         }
      } catch (InterruptedException e) {
         Thread.currentThread().interrupt();
      }
      executor_ = null;
      logger_.info("Stopped scanning {}", folder_);
   }

   private void run() {
      while (running_) {
         try {
            scan();
         } catch (IOException e) {
            logger_.warn("Could not list scan folder " + folder_, e);
         } catch (RuntimeException e) {
            logger_.error("Folder scan pass failed", e);
         }
         try {
            Thread.sleep(retryPeriodMs_);
         } catch (InterruptedException e) {
            return;
         }
      }
   }

   /**
    * One pass over the folder: hand over every new file whose size is stable
    */
   void scan() throws IOException {
      List<Path> ready = new ArrayList<>();
      synchronized (seen_) {
         for (String name : listFiles()) {
            if (seen_.contains(name) || ImageReader.isIgnored(name)) {
               continue;
            }
            Path file = folder_.resolve(name);
            long size = Files.size(file);
            Long previous = pendingSizes_.put(name, size);
            if (previous != null && previous == size && size > 0) {
               pendingSizes_.remove(name);
               seen_.add(name);
               ready.add(file);
            }
         }
      }
      for (int i = 0; i < ready.size(); i++) {
         BackpressureGate gate = gate_;
         if (!running_ || (gate != null && !gate.waitForDownstream())) {
            // not admitted, look at the remaining files again on the next pass
            synchronized (seen_) {
               for (Path file : ready.subList(i, ready.size())) {
                  seen_.remove(file.getFileName().toString());
               }
            }
            return;
         }
         readAndForward(ready.get(i));
      }
   }

   private void readAndForward(Path file) {
      try {
         Image image = reader_.read(file);
         Consumer<Image> listener = listener_;
         if (listener != null) {
            listener.accept(image);
         }
         if (messageHub_ != null) {
            messageHub_.dispatchInfo("Successful image read from {}", file);
         }
      } catch (ImageReadException e) {
         reportReadError(file, e.getMessage());
      } catch (RuntimeException e) {
         logger_.error("Unexpected error reading " + file, e);
         reportReadError(file, e.getMessage() == null ? e.toString() : e.getMessage());
      }
   }

   private void reportReadError(Path file, String message) {
      logger_.warn("Error reading from file {} : {}", file, message);
      if (messageHub_ != null) {
         messageHub_.dispatchError("Error reading from file {} : {}", file, message);
      }
   }

   private List<String> listFiles() throws IOException {
      List<String> names = new ArrayList<>();
      try (DirectoryStream<Path> stream = Files.newDirectoryStream(folder_)) {
         for (Path p : stream) {
            if (Files.isRegularFile(p)) {
               names.add(p.getFileName().toString());
            }
         }
      }
      Collections.sort(names);
      return names;
   }
}
