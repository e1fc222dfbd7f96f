package com.ciro.searchselect.standalone;

import io.undertow.util.AttachmentKey;

public final class UndertowAttachments {
    private UndertowAttachments() {}

    public static final AttachmentKey<String> SESSION_ID = AttachmentKey.create(String.class);
}
