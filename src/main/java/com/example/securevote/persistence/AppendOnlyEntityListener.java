package com.example.securevote.persistence;

import jakarta.persistence.PreRemove;
import jakarta.persistence.PreUpdate;

/**
 * JPA guard for append-only entities. The database triggers are the primary enforcement;
 * this stops the application from even issuing the statement.
 */
public class AppendOnlyEntityListener {

    @PreUpdate
    public void rejectUpdate(Object entity) {
        throw new AppendOnlyViolationException("Update rejected on append-only entity " + entity.getClass().getSimpleName());
    }

    @PreRemove
    public void rejectRemove(Object entity) {
        throw new AppendOnlyViolationException("Delete rejected on append-only entity " + entity.getClass().getSimpleName());
    }
}
