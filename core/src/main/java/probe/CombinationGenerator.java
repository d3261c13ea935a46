package probe;

import model.Credential;
import model.Endpoint;
import model.ProbeDescriptor;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Ленивый генератор дескрипторов перебора.
 *
 * <p>Порядок детерминирован: внешний цикл по портам, затем по пользователям, затем по паролям.
 * В режиме combo-list каждая пара комбинируется только с портами.
 * Каждый вызов {@link #iterator()} начинает последовательность заново; полное
 * декартово произведение в памяти не строится.
 */
public final class CombinationGenerator implements Iterable<ProbeDescriptor> {
    private final BruteForceSpec spec;

    public CombinationGenerator(BruteForceSpec spec) {
        this.spec = spec;
    }

    public long totalAttempts() {
        return spec.totalAttempts();
    }

    @Override
    public Iterator<ProbeDescriptor> iterator() {
        return spec.isComboMode() ? new ComboIterator() : new CrossProductIterator();
    }

    private ProbeDescriptor descriptor(int portIndex, Credential credential) {
        Endpoint endpoint = new Endpoint(spec.getHost(), spec.getPorts().get(portIndex), spec.getProtocol());
        return new ProbeDescriptor(endpoint, credential, spec.getCheckPath());
    }

    private final class CrossProductIterator implements Iterator<ProbeDescriptor> {
        private int port;
        private int user;
        private int pass;

        @Override
        public boolean hasNext() {
            return !spec.getUsernames().isEmpty()
                && !spec.getPasswords().isEmpty()
                && port < spec.getPorts().size();
        }

        @Override
        public ProbeDescriptor next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            ProbeDescriptor next = descriptor(port,
                new Credential(spec.getUsernames().get(user), spec.getPasswords().get(pass)));

            if (++pass == spec.getPasswords().size()) {
                pass = 0;
                if (++user == spec.getUsernames().size()) {
                    user = 0;
                    port++;
                }
            }
            return next;
        }
    }

    private final class ComboIterator implements Iterator<ProbeDescriptor> {
        private int port;
        private int combo;

        @Override
        public boolean hasNext() {
            return port < spec.getPorts().size();
        }

        @Override
        public ProbeDescriptor next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            ProbeDescriptor next = descriptor(port, spec.getCombos().get(combo));
            if (++combo == spec.getCombos().size()) {
                combo = 0;
                port++;
            }
            return next;
        }
    }
}
