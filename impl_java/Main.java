import mathematics.GroupTheory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import proof.Library;
import proof.Theorem;

import java.util.List;
import java.util.Optional;

public class Main {
    private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        final Library library = GroupTheory.library();

        List<String> names = args.length > 0 ? List.of(args) : List.copyOf(library.names());
        if (args.length == 0) {
            LOGGER.info("No theorem names given, printing all {} theorems", library.size());
        }
        for (String name : names) {
            Optional<Theorem> theorem = library.get(name);
            if (theorem.isEmpty()) {
                LOGGER.warn("Unknown theorem {}, expected one of {}", name, library.names());
                continue;
            }
            LOGGER.info("{}: {}", name, theorem.get());
            LOGGER.debug("{} is derived in {} steps", name, theorem.get().derivationSize());
        }
    }
}
