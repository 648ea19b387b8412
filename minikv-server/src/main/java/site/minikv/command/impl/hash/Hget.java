package site.minikv.command.impl.hash;

import site.minikv.command.AbstractCommand;
import site.minikv.command.CommandType;
import site.minikv.core.KvCore;
import site.minikv.datastructure.KvBytes;
import site.minikv.protocol.BulkString;
import site.minikv.protocol.Resp;

public class Hget extends AbstractCommand {
    private final KvCore kvCore;

    public Hget(final KvCore kvCore) {
        this.kvCore = kvCore;
    }

    @Override
    public CommandType getType() {
        return CommandType.HGET;
    }

    @Override
    public Resp handle() {
        if (args.length != 2) {
            return wrongNumberOfArguments();
        }
        final KvBytes hash = bulkArgument(0);
        final KvBytes field = bulkArgument(1);
        if (hash == null || field == null) {
            return wrongTypeOfArgument();
        }
        final KvBytes value = kvCore.hashGet(hash, field);
        return value == null ? BulkString.NULL : new BulkString(value);
    }
}
