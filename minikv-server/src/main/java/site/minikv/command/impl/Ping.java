package site.minikv.command.impl;

import site.minikv.command.AbstractCommand;
import site.minikv.command.CommandType;
import site.minikv.datastructure.KvBytes;
import site.minikv.protocol.Errors;
import site.minikv.protocol.Resp;
import site.minikv.protocol.SimpleString;

public class Ping extends AbstractCommand {
    @Override
    public CommandType getType() {
        return CommandType.PING;
    }

    @Override
    public Resp handle() {
        if (args.length == 0) {
            return SimpleString.PONG;
        }
        if (args.length > 1) {
            return wrongNumberOfArguments();
        }
        final KvBytes message = bulkArgument(0);
        if (message == null) {
            return wrongTypeOfArgument();
        }
        // 简单字符串回复不能包含行结束符
        for (final byte b : message.getBytesUnsafe()) {
            if (b == '\r' || b == '\n') {
                return new Errors("ERR PING message must not contain CR or LF");
            }
        }
        return new SimpleString(message.getString());
    }
}
