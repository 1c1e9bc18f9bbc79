package org.livestack.stackj.main;

import org.junit.Assert;
import org.junit.Test;

public class TestSession {

   @Test
   public void testLegalTransitions() {
      Session session = new Session(null);
      Assert.assertTrue(session.isStopped());
      Assert.assertTrue(session.setStatus(SessionStatus.RUNNING));
      Assert.assertTrue(session.setStatus(SessionStatus.PAUSED));
      Assert.assertTrue(session.setStatus(SessionStatus.RUNNING));
      Assert.assertTrue(session.setStatus(SessionStatus.STOPPED));
      Assert.assertTrue(session.setStatus(SessionStatus.RUNNING));
      Assert.assertTrue(session.setStatus(SessionStatus.PAUSED));
      Assert.assertTrue(session.setStatus(SessionStatus.STOPPED));
   }

   @Test
   public void testSameStatusIsNoOp() {
      Session session = new Session(null);
      Assert.assertFalse(session.setStatus(SessionStatus.STOPPED));
      session.setStatus(SessionStatus.RUNNING);
      Assert.assertFalse(session.setStatus(SessionStatus.RUNNING));
      Assert.assertTrue(session.isRunning());
   }

   @Test(expected = IllegalStateException.class)
   public void testCannotPauseStoppedSession() {
      new Session(null).setStatus(SessionStatus.PAUSED);
   }

   @Test
   public void testTransitionTable() {
      Assert.assertTrue(SessionStatus.STOPPED.canTransitionTo(SessionStatus.RUNNING));
      Assert.assertFalse(SessionStatus.STOPPED.canTransitionTo(SessionStatus.PAUSED));
      Assert.assertTrue(SessionStatus.RUNNING.canTransitionTo(SessionStatus.PAUSED));
      Assert.assertTrue(SessionStatus.RUNNING.canTransitionTo(SessionStatus.STOPPED));
      Assert.assertTrue(SessionStatus.PAUSED.canTransitionTo(SessionStatus.RUNNING));
      Assert.assertTrue(SessionStatus.PAUSED.canTransitionTo(SessionStatus.STOPPED));
   }
}
