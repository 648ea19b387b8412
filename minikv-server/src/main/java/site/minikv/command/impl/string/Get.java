package site.minikv.command.impl.string;

import site.minikv.command.AbstractCommand;
import site.minikv.command.CommandType;
import site.minikv.core.KvCore;
import site.minikv.datastructure.KvBytes;
import site.minikv.protocol.BulkString;
import site.minikv.protocol.Resp;

public class Get extends AbstractCommand {
    private final KvCore kvCore;

    public Get(final KvCore kvCore) {
        this.kvCore = kvCore;
    }

    @Override
    public CommandType getType() {
        return CommandType.GET;
    }

    @Override
    public Resp handle() {
        if (args.length != 1) {
            return wrongNumberOfArguments();
        }
        final KvBytes key = bulkArgument(0);
        if (key == null) {
            return wrongTypeOfArgument();
        }
        final KvBytes value = kvCore.stringGet(key);
        return value == null ? BulkString.NULL : new BulkString(value);
    }
}
