package app;

import java.util.List;

import com.beust.jcommander.converters.IParameterSplitter;

/** Keeps list-valued flags whole; operation specs contain commas ({@code region=0,0,8,8}). */
public class NoSplitter implements IParameterSplitter {

    @Override
    public List<String> split(String value) {
        return List.of(value);
    }
}
