package kvstore.timeout;

/**
 * Work executed when a timeout expires.
 *
 * <p>Runs on the manager's timer thread. Exceptions are logged and counted; the timeout
 * is not retried.
 */
@FunctionalInterface
public interface TimeoutAction {

    void execute(TimeoutRecord record) throws Exception;
}
