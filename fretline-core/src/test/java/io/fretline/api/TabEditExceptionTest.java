package io.fretline.api;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class TabEditExceptionTest {

  @Test
  void formatsContextAndCode() {
    TabEditException e =
        new TabEditException(ErrorCode.EMPTY_CLIPBOARD, "Nothing to yank", "staff 2");
    assertEquals(
        "Nothing to yank [Context: staff 2] [Error Code: EMPTY_CLIPBOARD]", e.getMessage());
    assertEquals(ErrorCode.EMPTY_CLIPBOARD, e.getErrorCode());
    assertEquals("staff 2", e.getContext());
  }

  @Test
  void contextIsOptional() {
    TabEditException e = new TabEditException(ErrorCode.NO_REGION, "The mark is not set");
    assertEquals("The mark is not set [Error Code: NO_REGION]", e.getMessage());
    assertNull(e.getContext());
  }
}
