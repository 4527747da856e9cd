package kvstore.spring.boot;

import kvstore.timeout.DuplicateTimeoutException;
import kvstore.timeout.TimeoutAction;
import kvstore.timeout.TimeoutManager;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.Map;

/**
 * Scans for beans annotated with {@link TimeoutHandler} and registers them with the
 * {@link TimeoutManager}.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton},
 * which is before {@link KvStoreLifecycle} connects the store and recovery starts.
 *
 * @see TimeoutHandler
 */
public class TimeoutHandlerRegistrar implements SmartInitializingSingleton {

    private final ListableBeanFactory beanFactory;
    private final TimeoutManager timeoutManager;

    public TimeoutHandlerRegistrar(ListableBeanFactory beanFactory, TimeoutManager timeoutManager) {
        this.beanFactory = beanFactory;
        this.timeoutManager = timeoutManager;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(TimeoutHandler.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof TimeoutAction action)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @TimeoutHandler must implement TimeoutAction, " +
                                "but " + bean.getClass().getName() + " does not");
            }

            TimeoutHandler annotation = bean.getClass().getAnnotation(TimeoutHandler.class);
            if (annotation == null) {
                // proxies hide the annotation
                annotation = AnnotationUtils.findAnnotation(bean.getClass(), TimeoutHandler.class);
            }
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @TimeoutHandler annotation on " + bean.getClass().getName());
            }

            try {
                timeoutManager.registerTimeout(annotation.value(), action);
            } catch (DuplicateTimeoutException | IllegalArgumentException e) {
                throw new BeanCreationException(beanName,
                        "Cannot register @TimeoutHandler(\"" + annotation.value() + "\")", e);
            }
        }
    }
}
