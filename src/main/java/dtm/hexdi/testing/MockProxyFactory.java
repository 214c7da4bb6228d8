package dtm.hexdi.testing;

import lombok.NonNull;
import net.bytebuddy.ByteBuddy;
import net.bytebuddy.dynamic.DynamicType;
import net.bytebuddy.dynamic.loading.ClassLoadingStrategy;
import net.bytebuddy.implementation.MethodDelegation;
import net.bytebuddy.matcher.ElementMatchers;

import java.lang.reflect.Field;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

final class MockProxyFactory {

    private static final String INTERCEPTOR_FIELD = "___interceptor";
    private static final Map<Class<?>, Class<?>> proxyCache = new ConcurrentHashMap<>();

    private MockProxyFactory() {
    }

    static <T> T newProxy(@NonNull Class<T> type, @NonNull MockInterceptor interceptor) {
        Class<?> proxyClass = proxyCache.computeIfAbsent(type, MockProxyFactory::makeProxyClass);
        try {
            Object proxy = proxyClass.getDeclaredConstructor().newInstance();
            Field interceptorField = proxyClass.getDeclaredField(INTERCEPTOR_FIELD);
            interceptorField.setAccessible(true);
            interceptorField.set(proxy, interceptor);
            return type.cast(proxy);
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Erro ao instanciar mock para " + type.getName(), e);
        }
    }

    private static Class<?> makeProxyClass(Class<?> type) {
        try (DynamicType.Unloaded<?> unloaded = new ByteBuddy()
                .subclass(Object.class)
                .implement(type)
                .defineField(INTERCEPTOR_FIELD, MockInterceptor.class)
                .method(ElementMatchers.not(ElementMatchers.isDeclaredBy(Object.class)))
                .intercept(MethodDelegation.toField(INTERCEPTOR_FIELD))
                .make()) {

            return unloaded
                    .load(type.getClassLoader(), ClassLoadingStrategy.Default.WRAPPER)
                    .getLoaded();

        } catch (Exception e) {
            throw new IllegalStateException("Erro ao criar proxy de mock para " + type.getName(), e);
        }
    }
}
