package site.minikv.command;

import site.minikv.datastructure.KvBytes;
import site.minikv.protocol.BulkString;
import site.minikv.protocol.Errors;
import site.minikv.protocol.Resp;

/**
 * 命令的公共基类，保存参数并提供参数校验和错误回复的辅助方法。
 *
 * @since 1.0.0
 */
public abstract class AbstractCommand implements Command {
    protected Resp[] args = new Resp[0];

    @Override
    public void setContext(final Resp[] args) {
        this.args = args == null ? new Resp[0] : args;
    }

    protected Errors wrongNumberOfArguments() {
        return new Errors("ERR wrong number of arguments for '" + getType().getLowerName() + "' command");
    }

    protected Errors wrongTypeOfArgument() {
        return new Errors("ERR wrong type of argument for '" + getType().getLowerName() + "' command");
    }

    /**
     * 取第index个参数的字节内容
     *
     * @return 参数内容；参数不是非Null的批量字符串时返回null
     */
    protected KvBytes bulkArgument(final int index) {
        final Resp arg = args[index];
        if (!(arg instanceof BulkString) || ((BulkString) arg).isNull()) {
            return null;
        }
        return ((BulkString) arg).getContent();
    }
}
