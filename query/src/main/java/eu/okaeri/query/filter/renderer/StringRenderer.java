package eu.okaeri.query.filter.renderer;

import lombok.NonNull;

public interface StringRenderer {

    String render(@NonNull String text);
}
