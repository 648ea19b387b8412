package site.minikv.command.impl.string;

import lombok.extern.slf4j.Slf4j;
import site.minikv.command.AbstractCommand;
import site.minikv.command.CommandType;
import site.minikv.core.KvCore;
import site.minikv.datastructure.KvBytes;
import site.minikv.protocol.Resp;
import site.minikv.protocol.SimpleString;

@Slf4j
public class Set extends AbstractCommand {
    private final KvCore kvCore;

    public Set(final KvCore kvCore) {
        this.kvCore = kvCore;
    }

    @Override
    public CommandType getType() {
        return CommandType.SET;
    }

    @Override
    public Resp handle() {
        if (args.length != 2) {
            return wrongNumberOfArguments();
        }
        final KvBytes key = bulkArgument(0);
        final KvBytes value = bulkArgument(1);
        if (key == null || value == null) {
            return wrongTypeOfArgument();
        }
        kvCore.stringSet(key, value);
        log.debug("set key:{} value:{}", key, value);
        return SimpleString.OK;
    }
}
