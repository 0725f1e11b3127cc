package org.stianloader.picodep.logging;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Objects;
import java.util.logging.Logger;

import org.jetbrains.annotations.NotNull;

class JULLogAdapter extends LoggingAdapter {

    @NotNull
    static String createMessage(@NotNull String message, Object... args) {
        StringBuilder builder = new StringBuilder();
        String remainder = message;
        for (int i = 0; i < args.length; i++) {
            int replaceHead = remainder.indexOf("{}");
            if (replaceHead != -1) {
                builder.append(remainder, 0, replaceHead).append(Objects.toString(args[i]));
                remainder = remainder.substring(replaceHead + 2);
                continue;
            }
            builder.append(remainder);
            remainder = "";
            if (i == (args.length - 1) && args[i] instanceof Throwable) {
                StringWriter sw = new StringWriter();
                ((Throwable) args[i]).printStackTrace(new PrintWriter(sw));
                builder.append('\n').append(sw);
            } else {
                builder.append(' ').append(Objects.toString(args[i]));
            }
        }

        builder.append(remainder);
        return builder.toString();
    }

    @Override
    public void debug(Class<?> clazz, String message, Object... args) {
        Logger.getLogger(clazz.getName()).fine(() -> JULLogAdapter.createMessage(message, args));
    }

    @Override
    public void error(Class<?> clazz, String message, Object... args) {
        Logger.getLogger(clazz.getName()).severe(() -> JULLogAdapter.createMessage(message, args));
    }

    @Override
    public void info(Class<?> clazz, String message, Object... args) {
        Logger.getLogger(clazz.getName()).info(() -> JULLogAdapter.createMessage(message, args));
    }

    @Override
    public void warn(Class<?> clazz, String message, Object... args) {
        Logger.getLogger(clazz.getName()).warning(() -> JULLogAdapter.createMessage(message, args));
    }
}
