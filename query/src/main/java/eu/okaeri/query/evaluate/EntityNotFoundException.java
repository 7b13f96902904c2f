package eu.okaeri.query.evaluate;

import lombok.Getter;
import lombok.NonNull;

@Getter
public class EntityNotFoundException extends RuntimeException {

    private final String entity;

    public EntityNotFoundException(@NonNull String entity) {
        super("unknown entity '" + entity + "'");
        this.entity = entity;
    }
}
