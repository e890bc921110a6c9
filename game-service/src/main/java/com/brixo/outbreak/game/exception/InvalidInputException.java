package com.brixo.outbreak.game.exception;

/**
 * Se lanza cuando la entrada de un cliente o del operador está mal formada
 * (campo ausente, JSON inválido, valor de configuración no entero o fuera de
 * rango). El estado de la partida no cambia.
 */
public class InvalidInputException extends RuntimeException {

    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
