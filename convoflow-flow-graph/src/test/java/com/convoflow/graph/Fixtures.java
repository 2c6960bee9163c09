package com.convoflow.graph;

import com.convoflow.schema.FlowJson;
import com.convoflow.schema.model.FlowDocument;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

public final class Fixtures {

    private Fixtures() {
    }

    public static FlowDocument load(String name) {
        try (InputStream in = Fixtures.class.getResourceAsStream("/flows/" + name)) {
            if (in == null) throw new IllegalArgumentException("Missing fixture " + name);
            return FlowJson.fromJson(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
