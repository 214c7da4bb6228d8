package dtm.hexdi.prototypes;

import lombok.Getter;
import lombok.NonNull;

/**
 * Contrato abstrato que um serviço satisfaz ou do qual depende.
 *
 * A identidade de uma porta é o seu nome: duas instâncias com o mesmo nome
 * representam a mesma porta, independente do tipo declarado. O tipo serve apenas
 * para dar tipagem às chamadas de {@code resolve}.
 *
 * @param <T> tipo do serviço representado pela porta
 */
@Getter
public final class Port<T> {

    private final String name;
    private final Class<T> type;

    private Port(String name, Class<T> type) {
        this.name = name;
        this.type = type;
    }

    /**
     * Cria uma porta.
     *
     * @param name nome único da porta dentro de um grafo
     * @param type tipo do serviço representado
     * @throws IllegalArgumentException se o nome estiver vazio
     */
    public static <T> Port<T> of(@NonNull String name, @NonNull Class<T> type) {
        if (name.isBlank()) {
            throw new IllegalArgumentException("Port name must not be blank");
        }
        return new Port<>(name, type);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof Port<?> port)) return false;
        return name.equals(port.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
