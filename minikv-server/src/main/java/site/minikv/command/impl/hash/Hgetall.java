package site.minikv.command.impl.hash;

import site.minikv.command.AbstractCommand;
import site.minikv.command.CommandType;
import site.minikv.core.KvCore;
import site.minikv.datastructure.KvBytes;
import site.minikv.protocol.BulkString;
import site.minikv.protocol.Resp;
import site.minikv.protocol.RespArray;

import java.util.Map;

/**
 * HGETALL key：按字段、值交替的顺序返回哈希的全部内容，哈希不存在时返回空数组
 */
public class Hgetall extends AbstractCommand {
    private final KvCore kvCore;

    public Hgetall(final KvCore kvCore) {
        this.kvCore = kvCore;
    }

    @Override
    public CommandType getType() {
        return CommandType.HGETALL;
    }

    @Override
    public Resp handle() {
        if (args.length != 1) {
            return wrongNumberOfArguments();
        }
        final KvBytes hash = bulkArgument(0);
        if (hash == null) {
            return wrongTypeOfArgument();
        }
        final Map<KvBytes, KvBytes> fields = kvCore.hashGetAll(hash);
        if (fields.isEmpty()) {
            return RespArray.EMPTY;
        }
        final Resp[] content = new Resp[fields.size() * 2];
        int i = 0;
        for (Map.Entry<KvBytes, KvBytes> entry : fields.entrySet()) {
            content[i++] = new BulkString(entry.getKey());
            content[i++] = new BulkString(entry.getValue());
        }
        return new RespArray(content);
    }
}
