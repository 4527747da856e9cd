package kvstore.spring.boot;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as the action for a timeout id.
 *
 * <p>The annotated bean must implement {@link kvstore.timeout.TimeoutAction}.
 *
 * <pre>{@code
 * @Component
 * @TimeoutHandler("reminder")
 * public class ReminderAction implements TimeoutAction {
 *   public void execute(TimeoutRecord record) { ... }
 * }
 * }</pre>
 *
 * @see TimeoutHandlerRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface TimeoutHandler {

    /**
     * Timeout id handled by the bean.
     */
    String value();
}
