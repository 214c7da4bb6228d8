package dtm.hexdi.prototypes;

import lombok.Getter;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Provedor registrado para uma {@link Port}.
 *
 * Um adapter é imutável e declara:
 * <ul>
 *   <li>a porta que fornece;</li>
 *   <li>as portas das quais depende, na ordem declarada;</li>
 *   <li>o {@link Lifetime} das instâncias que cria;</li>
 *   <li>a {@link Factory} que monta a instância;</li>
 *   <li>um {@link Finalizer} opcional chamado no descarte.</li>
 * </ul>
 *
 * @param <T> tipo do serviço fornecido
 */
@Getter
public final class Adapter<T> {

    private final Port<T> provides;
    private final List<Port<?>> requires;
    private final Lifetime lifetime;
    private final Factory<T> factory;
    private final Finalizer<T> finalizer;

    private Adapter(Builder<T> builder) {
        this.provides = builder.provides;
        this.requires = List.copyOf(builder.requires);
        this.lifetime = builder.lifetime;
        this.factory = builder.factory;
        this.finalizer = builder.finalizer;
    }

    public static <T> Builder<T> builder(@NonNull Port<T> provides) {
        return new Builder<>(provides);
    }

    public String getPortName() {
        return provides.getName();
    }

    public List<String> getRequiredPortNames() {
        return requires.stream().map(Port::getName).collect(Collectors.toList());
    }

    public Optional<Finalizer<T>> findFinalizer() {
        return Optional.ofNullable(finalizer);
    }

    public boolean hasFinalizer() {
        return finalizer != null;
    }

    /**
     * Cópia deste adapter com outro lifetime, mantendo factory e finalizer.
     */
    public Adapter<T> withLifetime(@NonNull Lifetime lifetime) {
        return toBuilder().lifetime(lifetime).build();
    }

    public Builder<T> toBuilder() {
        Builder<T> builder = new Builder<>(provides)
                .requires(requires)
                .lifetime(lifetime)
                .factory(factory);
        if (finalizer != null) {
            builder.finalizer(finalizer);
        }
        return builder;
    }

    @Override
    public String toString() {
        return "Adapter[" + provides.getName() + " (" + lifetime + ") <- " + getRequiredPortNames() + "]";
    }

    public static final class Builder<T> {
        private final Port<T> provides;
        private final LinkedHashSet<Port<?>> requires = new LinkedHashSet<>();
        private Lifetime lifetime = Lifetime.SINGLETON;
        private Factory<T> factory;
        private Finalizer<T> finalizer;

        private Builder(Port<T> provides) {
            this.provides = provides;
        }

        public Builder<T> requires(@NonNull Port<?>... ports) {
            return requires(List.of(ports));
        }

        public Builder<T> requires(@NonNull Collection<? extends Port<?>> ports) {
            this.requires.addAll(new ArrayList<>(ports));
            return this;
        }

        public Builder<T> lifetime(@NonNull Lifetime lifetime) {
            this.lifetime = lifetime;
            return this;
        }

        public Builder<T> factory(@NonNull Factory<T> factory) {
            this.factory = factory;
            return this;
        }

        public Builder<T> finalizer(@NonNull Finalizer<T> finalizer) {
            this.finalizer = finalizer;
            return this;
        }

        public Builder<T> syncFinalizer(@NonNull Finalizer.SyncFinalizer<T> finalizer) {
            return finalizer(Finalizer.of(finalizer));
        }

        public Adapter<T> build() {
            if (factory == null) {
                throw new IllegalStateException("Adapter for port '" + provides.getName() + "' has no factory");
            }
            return new Adapter<>(this);
        }
    }
}
