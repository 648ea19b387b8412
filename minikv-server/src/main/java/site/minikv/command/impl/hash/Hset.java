package site.minikv.command.impl.hash;

import site.minikv.command.AbstractCommand;
import site.minikv.command.CommandType;
import site.minikv.core.KvCore;
import site.minikv.datastructure.KvBytes;
import site.minikv.protocol.Resp;
import site.minikv.protocol.SimpleString;

public class Hset extends AbstractCommand {
    private final KvCore kvCore;

    public Hset(final KvCore kvCore) {
        this.kvCore = kvCore;
    }

    @Override
    public CommandType getType() {
        return CommandType.HSET;
    }

    @Override
    public Resp handle() {
        if (args.length != 3) {
            return wrongNumberOfArguments();
        }
        final KvBytes hash = bulkArgument(0);
        final KvBytes field = bulkArgument(1);
        final KvBytes value = bulkArgument(2);
        if (hash == null || field == null || value == null) {
            return wrongTypeOfArgument();
        }
        kvCore.hashSet(hash, field, value);
        return SimpleString.OK;
    }
}
