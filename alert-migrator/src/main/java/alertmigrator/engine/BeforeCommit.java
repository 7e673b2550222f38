package alertmigrator.engine;

import alertmigrator.exceptions.MigrateException;

/**
 * Work executed inside a run's transaction after the run succeeded and right
 * before the commit. Throwing rolls the whole run back.
 */
@FunctionalInterface
public interface BeforeCommit {

    BeforeCommit NONE = () -> { };

    void run() throws MigrateException;
}
